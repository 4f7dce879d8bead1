package ru.marthastudios.nudgebot.configuration;

import com.azure.identity.ClientSecretCredential;
import com.azure.identity.ClientSecretCredentialBuilder;
import com.microsoft.graph.serviceclient.GraphServiceClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;
import ru.marthastudios.nudgebot.property.GraphProperty;

@Configuration
public class ClientConfiguration {
    private static final String[] GRAPH_SCOPES = {"https://graph.microsoft.com/.default"};

    @Bean
    public RestTemplate restTemplate() {
        return new RestTemplate();
    }

    @Bean
    public GraphServiceClient graphServiceClient(GraphProperty graphProperty) {
        ClientSecretCredential credential = new ClientSecretCredentialBuilder()
                .tenantId(graphProperty.getTenantId())
                .clientId(graphProperty.getClientId())
                .clientSecret(graphProperty.getClientSecret())
                .build();

        return new GraphServiceClient(credential, GRAPH_SCOPES);
    }
}
