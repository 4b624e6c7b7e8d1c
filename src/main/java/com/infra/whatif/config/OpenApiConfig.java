package com.infra.whatif.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI whatIfAdvisorOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("What-If Advisor API")
                        .version("1.0.0")
                        .description(
                                "Confidence-gated deployment safety evaluation for Azure What-If output.\n\n" +
                                "**Evaluation Pipeline:**\n" +
                                "1. Submit What-If output via `POST /deployments/evaluate`\n" +
                                "2. The classification oracle annotates each change with action, description and confidence\n" +
                                "3. Descriptions matching user-supplied noise phrases are marked as noise\n" +
                                "4. Changes are split: high/medium confidence are retained, low/noise are excluded\n" +
                                "5. If anything was excluded, the oracle re-assesses risk over the retained changes only\n" +
                                "6. Each risk bucket is compared to its threshold; a bucket **fails** when its level meets or exceeds the threshold\n\n" +
                                "**Risk Buckets:**\n" +
                                "- `drift`: What-If changes not explained by the code diff\n" +
                                "- `intent`: changes that stray from the pull request's stated purpose (only with PR context)\n" +
                                "- `operations`: inherently risky operations such as deletions and security changes")
                        .contact(new Contact().name("Deployment Safety Team")));
    }
}
