package com.batchinsight.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${app.batch.max-documents:10000}")
    private int maxDocuments;

    @Bean
    public OpenAPI batchInsightOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("BatchInsight API")
                        .description("Submits document batches to the high, normal and low priority queues, "
                                + "reports batch progress and aggregate results, and replays dead-lettered jobs. "
                                + "A batch holds at most " + maxDocuments + " documents.")
                        .version("0.1.0"))
                .tags(List.of(
                        new Tag().name("Batches").description("Batch submission, status and cancellation"),
                        new Tag().name("Dead letters").description("Jobs that exhausted their retries or failed terminally")));
    }
}
