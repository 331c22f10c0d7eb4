package org.pragmatica.config.cli;

import org.junit.jupiter.api.Test;
import org.pragmatica.config.Either;
import org.pragmatica.config.descriptor.Descriptor;
import org.pragmatica.config.descriptor.Descriptors;
import org.pragmatica.config.read.ConfigReader;
import org.pragmatica.config.source.ConfigSource;
import org.pragmatica.config.tree.FlatEntry;
import org.pragmatica.config.tree.PropertyTree;
import org.pragmatica.config.tree.Step;
import org.pragmatica.config.write.ConfigWriter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.config.descriptor.Descriptors.integer;
import static org.pragmatica.config.descriptor.Descriptors.string;

class CommandLineConfigSourceTest {
    record Vault(String user, String password, List<String> regions) {}

    private static final Descriptor<Vault> VAULT = Descriptors.product(string("user"),
                                                                       string("password"),
                                                                       Descriptor.list("regions", string()),
                                                                       Vault::new,
                                                                       Vault::user,
                                                                       Vault::password,
                                                                       Vault::regions);

    @Test
    void fromCommandLineArgs_accumulatesRepeatedFlags() {
        for (int count = 1; count <= 10; count++) {
            var args = new ArrayList<String>();
            var expected = new ArrayList<Integer>();
            for (int i = 1; i <= count; i++) {
                args.add("--ints=" + i);
                expected.add(i);
            }

            var result = ConfigReader.read(Descriptor.list("ints", integer()), ConfigSource.fromCommandLineArgs(args));

            assertThat(result).isEqualTo(Either.right(expected));
        }
    }

    @Test
    void fromCommandLineArgs_readsFirstOccurrence_whenScalarFlagRepeated() {
        var source = ConfigSource.fromCommandLineArgs(List.of("--port=1", "--port=2"));

        assertThat(ConfigReader.read(integer("port"), source)).isEqualTo(Either.right(1));
        assertThat(ConfigReader.read(Descriptor.list("port", integer()), source)).isEqualTo(Either.right(List.of(1, 2)));
    }

    @Test
    void fromCommandLineArgs_readsNestedRecord() {
        var args = List.of("--vault", "--user=admin", "--vault.password=secret", "--vault.regions", "eu,us");

        var source = ConfigSource.fromCommandLineArgs(args, Optional.of('.'), Optional.of(','));

        assertThat(ConfigReader.read(Descriptor.nested("vault", VAULT), source))
            .isEqualTo(Either.right(new Vault("admin", "secret", List.of("eu", "us"))));
        assertThat(source.names()).containsExactly(CommandLineConfigSource.SOURCE_NAME);
    }

    @Test
    void fromCommandLineArgs_roundtripsSeparateKeyAndValue() {
        var vault = new Vault("admin", "s3cret", List.of("eu", "us", "ap"));
        var args = new ArrayList<String>();
        flatten(Descriptor.nested("vault", VAULT), vault).forEach(entry -> entry.values()
                                                                                .forEach(value -> {
                                                                                    args.add("--" + key(entry));
                                                                                    args.add(value);
                                                                                }));

        var result = ConfigReader.read(Descriptor.nested("vault", VAULT),
                                       ConfigSource.fromCommandLineArgs(args, Optional.of('_'), Optional.empty()));

        assertThat(result).isEqualTo(Either.right(vault));
    }

    @Test
    void fromCommandLineArgs_roundtripsSingleArgument() {
        var vault = new Vault("admin", "p=ss", List.of("eu"));
        var args = new ArrayList<String>();
        flatten(Descriptor.nested("vault", VAULT), vault).forEach(entry -> entry.values()
                                                                                .forEach(value -> args.add("-" + key(entry) + "=" + value)));

        var result = ConfigReader.read(Descriptor.nested("vault", VAULT),
                                       ConfigSource.fromCommandLineArgs(args, Optional.of('_'), Optional.empty()));

        assertThat(result).isEqualTo(Either.right(vault));
    }

    @Test
    void fromCommandLineArgs_fallsBackToOtherSource() {
        var source = ConfigSource.fromCommandLineArgs(List.of("--port=9090"))
                                 .orElse(ConfigSource.fromMap(Map.of("port", "80", "host", "localhost")));

        assertThat(ConfigReader.read(integer("port"), source)).isEqualTo(Either.right(9090));
        assertThat(ConfigReader.read(string("host"), source)).isEqualTo(Either.right("localhost"));
    }

    private static <A> List<FlatEntry<String>> flatten(Descriptor<A> descriptor, A value) {
        return ConfigWriter.write(descriptor, value)
                           .map(PropertyTree::flatten)
                           .unwrap();
    }

    private static String key(FlatEntry<String> entry) {
        return entry.path()
                    .stream()
                    .map(Step::toString)
                    .collect(Collectors.joining("_"));
    }
}
