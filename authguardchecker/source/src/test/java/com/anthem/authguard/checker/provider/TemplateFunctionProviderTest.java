package com.anthem.authguard.checker.provider;

import com.anthem.authguard.core.model.ServerlessFunction;
import com.anthem.authguard.core.model.Stack;
import com.anthem.authguard.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateFunctionProviderTest {

    @Test
    void testGetAll_functionsAcrossStacksInOrder() {
        TemplateFunctionProvider provider = new TemplateFunctionProvider(List.of(
                stack("", """
                        Resources:
                          Second:
                            Type: AWS::Serverless::Function
                          First:
                            Type: AWS::Lambda::Function
                            Properties:
                              Events:
                                Ignored:
                                  Type: Api
                          Table:
                            Type: AWS::DynamoDB::Table
                        """),
                stack("Child/GrandChild", """
                        Resources:
                          Deep:
                            Type: AWS::Serverless::Function
                            Properties:
                              Events:
                                B:
                                  Type: HttpApi
                                A:
                                  Type: Api
                        """)));

        List<ServerlessFunction> functions = provider.getAll();

        assertThat(functions).extracting(ServerlessFunction::getName).containsExactly("Second", "First", "Deep");
        assertThat(functions).extracting(ServerlessFunction::getFullPath)
                .containsExactly("Second", "First", "Child/GrandChild/Deep");
        assertThat(functions.get(0).hasEvents()).isFalse();
        // plain Lambda functions never carry SAM events
        assertThat(functions.get(1).hasEvents()).isFalse();
        assertThat(functions.get(2).getStackPath()).isEqualTo("Child/GrandChild");
        assertThat(functions.get(2).getEvents().keySet()).containsExactly("B", "A");
    }

    @Test
    void testGetResourcesByStackPath() {
        TemplateFunctionProvider provider = new TemplateFunctionProvider(List.of(
                stack("", "Resources:\n  RootApi:\n    Type: AWS::Serverless::Api\n"),
                stack("Child", "Resources:\n  ChildApi:\n    Type: AWS::Serverless::HttpApi\n")));

        assertThat(provider.getResourcesByStackPath("").keySet()).containsExactly("RootApi");
        assertThat(provider.getResourcesByStackPath(null).keySet()).containsExactly("RootApi");
        assertThat(provider.getResourcesByStackPath("Child").keySet()).containsExactly("ChildApi");
        assertThat(provider.getResourcesByStackPath("Unknown")).isEmpty();
    }

    @Test
    void testGlobalsMergedIntoApiResources() {
        TemplateFunctionProvider provider = new TemplateFunctionProvider(List.of(stack("", """
                Globals:
                  HttpApi:
                    Auth:
                      DefaultAuthorizer: Jwt
                    CorsConfiguration:
                      AllowOrigins: ['*']
                      MaxAge: 10
                Resources:
                  Open:
                    Type: AWS::Serverless::HttpApi
                    Properties:
                      CorsConfiguration:
                        MaxAge: 60
                  NoProps:
                    Type: AWS::Serverless::HttpApi
                  Rest:
                    Type: AWS::Serverless::Api
                """)));

        Map<String, JsonNode> resources = provider.getResourcesByStackPath("");

        JsonNode open = resources.get("Open").path("Properties");
        assertThat(open.path("Auth").path("DefaultAuthorizer").asText()).isEqualTo("Jwt");
        assertThat(open.path("CorsConfiguration").path("MaxAge").asInt()).isEqualTo(60);
        assertThat(open.path("CorsConfiguration").path("AllowOrigins")).hasSize(1);
        assertThat(resources.get("NoProps").path("Properties").has("Auth")).isTrue();
        assertThat(resources.get("Rest").path("Properties").isMissingNode()).isTrue();
    }

    @Test
    void testMalformedInputDegradesToEmpty() {
        TemplateFunctionProvider provider = new TemplateFunctionProvider(List.of(
                Stack.builder().stackPath("").template(null).build(),
                stack("A", "Resources: not-a-mapping\n"),
                stack("B", """
                        Resources:
                          Fn:
                            Type: AWS::Serverless::Function
                            Properties:
                              Events: [one, two]
                        """)));

        assertThat(provider.getAll()).hasSize(1);
        assertThat(provider.getAll().get(0).hasEvents()).isFalse();
        assertThat(provider.getResourcesByStackPath("A")).isEmpty();
    }

    @Test
    void testDuplicateStackPathKeepsFirst() {
        TemplateFunctionProvider provider = new TemplateFunctionProvider(List.of(
                stack("", "Resources:\n  One:\n    Type: AWS::Serverless::Function\n"),
                stack("", "Resources:\n  Two:\n    Type: AWS::Serverless::Function\n")));

        assertThat(provider.getAll()).extracting(ServerlessFunction::getName).containsExactly("One");
    }

    private static Stack stack(String path, String yaml) {
        return Stack.builder()
                .stackPath(path)
                .template(JsonUtils.parseDocument(yaml))
                .build();
    }
}
