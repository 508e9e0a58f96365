package com.cloud.costspike.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI costSpikeDetectorOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Cloud Cost Spike Detector API")
                        .version("1.0.0")
                        .description(
                                "Detects unexpected upward spikes in cloud billing data.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Upload a CSV with `date`, `service`, `cost` columns (case-insensitive)\n" +
                                "2. Rows are validated and sorted by service, then date\n" +
                                "3. Calendar features and per-service rolling stats (7-row window) are derived\n" +
                                "4. An Isolation Forest (200 trees) scores every row; the top 5% are flagged\n" +
                                "5. Only **spikes** survive: cost above its rolling mean AND up versus the previous day\n" +
                                "6. Flagged spend is aggregated per service into a summary\n\n" +
                                "**Endpoints:**\n" +
                                "- `POST /api/v1/detect` returns the spike rows\n" +
                                "- `POST /api/v1/detect/summary` returns totals and the top services by anomalous spend\n" +
                                "- `POST /api/v1/detect/records` accepts already-parsed rows as JSON")
                        .contact(new Contact().name("FinOps Analytics Team")));
    }
}
