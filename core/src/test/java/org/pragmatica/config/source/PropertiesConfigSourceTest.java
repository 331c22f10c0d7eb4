package org.pragmatica.config.source;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pragmatica.config.ReadError;
import org.pragmatica.config.read.ConfigReader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.config.descriptor.Descriptors.string;
import static org.pragmatica.config.tree.PropertyTree.leaf;
import static org.pragmatica.config.tree.PropertyTree.sequenceOfLeaves;

class PropertiesConfigSourceTest {
    @TempDir
    Path tempDir;

    @Test
    void propertiesConfigSource_readsNestedKeys() {
        var properties = new Properties();
        properties.setProperty("database.host", "localhost");
        properties.setProperty("database.port", "5432");

        var source = PropertiesConfigSource.propertiesConfigSource(properties,
                                                                   SourceOptions.sourceOptions("properties")
                                                                                .withKeyDelimiter('.'));

        assertThat(source.getValue(List.of("database", "host"))).isEqualTo(leaf("localhost"));
        assertThat(source.getValue(List.of("database", "port"))).isEqualTo(leaf("5432"));
        assertThat(source.path()).isEmpty();
    }

    @Test
    void fromProperties_usesFlatKeysByDefault() {
        var properties = new Properties();
        properties.setProperty("database.host", "localhost");

        var source = ConfigSource.fromProperties(properties);

        assertThat(source.names()).containsExactly("properties");
        assertThat(source.getValue(List.of("database.host"))).isEqualTo(leaf("localhost"));
    }

    @Test
    void propertiesConfigSource_loadsFile() throws IOException {
        var file = tempDir.resolve("app.properties");
        Files.writeString(file, """
            # application settings
            server.hosts = a, b
            server.port = 8080
            """);

        var result = ConfigSource.fromPropertiesFile(file,
                                                     SourceOptions.sourceOptions("properties")
                                                                  .withKeyDelimiter('.')
                                                                  .withValueDelimiter(','));

        assertThat(result.isRight()).isTrue();
        var source = result.unwrap();
        assertThat(source.getValue(List.of("server", "hosts"))).isEqualTo(sequenceOfLeaves(List.of("a", "b")));
        assertThat(source.getValue(List.of("server", "port"))).isEqualTo(leaf("8080"));
        assertThat(source.names()).containsExactly(file.toString());
    }

    @Test
    void propertiesConfigSource_keepsExplicitName_whenLoadingFile() throws IOException {
        var file = tempDir.resolve("named.properties");
        Files.writeString(file, "a=1\n");

        var result = PropertiesConfigSource.propertiesConfigSource(file, SourceOptions.sourceOptions("defaults"));

        assertThat(result.unwrap()
                         .names()).containsExactly("defaults");
    }

    @Test
    void propertiesConfigSource_fails_whenFileMissing() {
        var result = PropertiesConfigSource.propertiesConfigSource(tempDir.resolve("missing.properties"),
                                                                   SourceOptions.sourceOptions("properties"));

        assertThat(result.isLeft()).isTrue();
        var error = result.leftValue()
                          .orElseThrow();
        assertThat(error).isInstanceOf(ReadError.SourceError.class);
        assertThat(error.message()).contains("missing.properties");
        assertThat(error.isRecoverable()).isFalse();
    }

    @Test
    void from_failsWithSourceError_whenBoundFileMissing() {
        var file = ConfigSource.fromPropertiesFile(tempDir.resolve("missing.properties"),
                                                   SourceOptions.sourceOptions("properties"));
        var descriptor = string("port").from(file)
                                       .orElse(string("port"));

        var result = ConfigReader.read(descriptor, ConfigSource.fromMap(Map.of("port", "8080")));

        assertThat(result.leftValue()
                         .orElseThrow()).isInstanceOf(ReadError.SourceError.class);
        assertThat(result.leftValue()
                         .orElseThrow()
                         .message()).contains("missing.properties");
    }
}
