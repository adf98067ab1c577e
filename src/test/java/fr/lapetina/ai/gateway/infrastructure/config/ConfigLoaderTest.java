package fr.lapetina.ai.gateway.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @Test
    @DisplayName("should load configuration from the classpath")
    void shouldLoadFromClasspath() {
        ProviderConfig config = new ConfigLoader("test-gateway.yaml").load();

        assertThat(config.getProvider()).isEqualTo("azure");
        assertThat(config.getDefaultModel()).isEqualTo("gpt-35-turbo");
        assertThat(config.getTimeoutMs()).isEqualTo(5000);
        assertThat(config.getOpenai()).isNull();
        assertThat(config.getAzure().getDeployment()).isEqualTo("chat-deployment");
        assertThat(config.getAzure().getApiVersion()).isEqualTo("2024-02-15-preview");
        assertThat(config.getRetry().getMaxAttempts()).isEqualTo(2);
        assertThat(config.getCircuitBreaker().getFailureThreshold()).isEqualTo(2);
        assertThat(config.getRateLimit().isEnabled()).isTrue();
        assertThat(config.getMetrics().getPrefix()).isEqualTo("test_gateway");
        assertThat(config.validate()).isEmpty();
    }

    @Test
    @DisplayName("should prefer a file on disk over the classpath")
    void shouldLoadFromFile(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("gateway.yaml");
        Files.writeString(file, """
                provider: openai
                openai:
                  apiKey: sk-file
                  organization: org-1
                """);

        ProviderConfig config = new ConfigLoader(file.toString()).load();

        assertThat(config.getProvider()).isEqualTo("openai");
        assertThat(config.getOpenai().getApiKey()).isEqualTo("sk-file");
        assertThat(config.getOpenai().getOrganization()).isEqualTo("org-1");
        assertThat(config.getDefaultModel()).isEqualTo("gpt-4o");
    }

    @Test
    @DisplayName("should return defaults for an empty document")
    void shouldDefaultEmptyDocument() {
        ProviderConfig config = new ConfigLoader("unused.yaml")
                .loadFromStream(new ByteArrayInputStream(new byte[0]));

        assertThat(config.getProvider()).isEqualTo("openai");
        assertThat(config.getTimeoutMs()).isEqualTo(100000);
    }

    @Test
    @DisplayName("should reject unknown properties")
    void shouldRejectInvalidYaml() {
        ConfigLoader loader = new ConfigLoader("unused.yaml");

        assertThatThrownBy(() -> loader.loadFromStream(
                new ByteArrayInputStream("unknownField: 1\n".getBytes(StandardCharsets.UTF_8))))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageStartingWith("Invalid configuration in stream");
    }

    @Test
    @DisplayName("should reject Azure settings the adapter does not support")
    void shouldRejectUnsupportedAzureSetting() {
        ConfigLoader loader = new ConfigLoader("unused.yaml");
        String yaml = "provider: azure\nazure:\n  deployment: chat\n  useResponsesApi: true\n";

        assertThatThrownBy(() -> loader.loadFromStream(
                new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageStartingWith("Invalid configuration in stream")
                .hasMessageContaining("useResponsesApi");
    }

    @Test
    @DisplayName("should fail when the file exists nowhere")
    void shouldFailWhenNotFound() {
        assertThatThrownBy(() -> new ConfigLoader("missing-gateway.yaml").load())
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessage("Configuration file not found: missing-gateway.yaml");
    }

    @Test
    @DisplayName("should build both provider sections from the environment")
    void shouldBuildFromEnvironment() {
        ProviderConfig config = ConfigLoader.fromEnvironment(Map.of(
                "AI_PROVIDER", "azure",
                "DEFAULT_MODEL", "gpt-4",
                "ENABLE_REASONING", "true",
                "TIMEOUT_MS", "1500",
                "OPENAI_API_KEY", "sk-env",
                "AZURE_OPENAI_API_KEY", "azure-env",
                "AZURE_OPENAI_ENDPOINT", "https://env.openai.azure.com",
                "AZURE_OPENAI_DEPLOYMENT", "env-deployment"));

        assertThat(config.getProvider()).isEqualTo("azure");
        assertThat(config.getDefaultModel()).isEqualTo("gpt-4");
        assertThat(config.isEnableReasoning()).isTrue();
        assertThat(config.getTimeoutMs()).isEqualTo(1500);
        assertThat(config.getOpenai().getApiKey()).isEqualTo("sk-env");
        assertThat(config.getAzure().getApiKey()).isEqualTo("azure-env");
        assertThat(config.getAzure().getDeployment()).isEqualTo("env-deployment");
        assertThat(config.getAzure().getApiVersion()).isEqualTo("2024-02-15-preview");
    }

    @Test
    @DisplayName("should treat empty environment values as unset")
    void shouldTreatEmptyValuesAsUnset() {
        ProviderConfig config = ConfigLoader.fromEnvironment(Map.of(
                "AI_PROVIDER", "",
                "DEFAULT_MODEL", ""));

        assertThat(config.getProvider()).isEqualTo("openai");
        assertThat(config.getDefaultModel()).isEqualTo("gpt-4o");
        assertThat(config.getOpenai().getApiKey()).isEmpty();
        assertThat(config.validate()).containsExactly("OpenAI API key is required when using OpenAI provider");
    }

    @Test
    @DisplayName("should reject a non-numeric timeout")
    void shouldRejectInvalidTimeout() {
        assertThatThrownBy(() -> ConfigLoader.fromEnvironment(Map.of("TIMEOUT_MS", "soon")))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("TIMEOUT_MS");
    }
}
