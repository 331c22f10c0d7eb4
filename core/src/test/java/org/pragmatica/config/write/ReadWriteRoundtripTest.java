package org.pragmatica.config.write;

import org.junit.jupiter.api.Test;
import org.pragmatica.config.Either;
import org.pragmatica.config.descriptor.Descriptor;
import org.pragmatica.config.descriptor.Descriptors;
import org.pragmatica.config.read.ConfigReader;
import org.pragmatica.config.source.ConfigSource;
import org.pragmatica.config.tree.LeafForSequence;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.config.descriptor.Descriptors.integer;
import static org.pragmatica.config.descriptor.Descriptors.string;

class ReadWriteRoundtripTest {
    record Server(String host, int port) {}

    record Credentials(String user, Optional<String> password) {}

    record Extras(List<Integer> ports, Optional<Credentials> credentials, Either<String, Integer> id) {}

    record App(String name, Server server, Extras extras) {}

    static final Descriptor<Server> SERVER = Descriptors.product(string("host"),
                                                                 integer("port"),
                                                                 Server::new,
                                                                 Server::host,
                                                                 Server::port);

    static final Descriptor<Credentials> CREDENTIALS = Descriptors.product(string("user"),
                                                                           string("password").optional(),
                                                                           Credentials::new,
                                                                           Credentials::user,
                                                                           Credentials::password);

    static final Descriptor<Extras> EXTRAS = Descriptors.product(Descriptor.list("ports", integer()),
                                                                 Descriptor.nested("credentials", CREDENTIALS)
                                                                           .optional(),
                                                                 string("id").orElseEither(integer("number")),
                                                                 Extras::new,
                                                                 Extras::ports,
                                                                 Extras::credentials,
                                                                 Extras::id);

    static final Descriptor<App> APP = Descriptors.product(string("name"),
                                                           Descriptor.nested("server", SERVER),
                                                           Descriptor.nested("extras", EXTRAS),
                                                           App::new,
                                                           App::name,
                                                           App::server,
                                                           App::extras);

    @Test
    void roundtrip_recoversScalar() {
        assertRoundtrip(string("name"), "value");
        assertRoundtrip(Descriptors.duration("timeout"), Duration.ofSeconds(30));
        assertRoundtrip(Descriptors.bool("enabled"), true);
    }

    @Test
    void roundtrip_recoversNestedRecord() {
        assertRoundtrip(Descriptor.nested("server", SERVER), new Server("localhost", 8080));
    }

    @Test
    void roundtrip_recoversOptionalInBothStates() {
        var descriptor = Descriptor.nested("credentials", CREDENTIALS)
                                   .optional();

        assertRoundtrip(descriptor, Optional.empty());
        assertRoundtrip(descriptor, Optional.of(new Credentials("admin", Optional.empty())));
        assertRoundtrip(descriptor, Optional.of(new Credentials("admin", Optional.of("secret"))));
    }

    @Test
    void roundtrip_recoversEitherSide() {
        var descriptor = string("id").orElseEither(integer("number"));

        assertRoundtrip(descriptor, Either.left("abc"));
        assertRoundtrip(descriptor, Either.right(42));
    }

    @Test
    void roundtrip_recoversEmptyListInsideOptional() {
        var descriptor = Descriptor.nested("cfg", Descriptor.list("xs", string()))
                                   .optional();

        assertRoundtrip(descriptor, Optional.of(List.of()));
        assertRoundtrip(descriptor, Optional.empty());
    }

    @Test
    void roundtrip_recoversMapAndRecordList() {
        assertRoundtrip(Descriptor.map("limits", integer()), Map.of("cpu", 2, "memory", 512));
        assertRoundtrip(Descriptor.list("servers", SERVER), List.of(new Server("a", 1), new Server("b", 2)));
    }

    @Test
    void roundtrip_recoversGeneratedApplications() {
        randomApps(100).forEach(app -> assertRoundtrip(APP, app));
    }

    @Test
    void roundtrip_recoversTransformedValue() {
        var descriptor = Descriptors.string("level")
                                    .<Level>to(Level::valueOf, Level::name);

        assertRoundtrip(descriptor, Level.WARN);
    }

    enum Level {
        INFO,
        WARN
    }

    static <A> void assertRoundtrip(Descriptor<A> descriptor, A value) {
        var tree = ConfigWriter.write(descriptor, value)
                               .unwrap();
        var source = ConfigSource.fromTree(tree, "written", LeafForSequence.VALID);

        assertThat(ConfigReader.read(descriptor, source)).isEqualTo(Either.right(value));
    }

    static List<App> randomApps(int count) {
        var random = new Random(7);
        var apps = new ArrayList<App>();
        Function<Integer, String> word = length -> randomWord(random, length);

        for (int i = 0; i < count; i++) {
            var ports = new ArrayList<Integer>();
            var size = random.nextInt(4);
            for (int j = 0; j < size; j++) {
                ports.add(random.nextInt(65536));
            }
            var credentials = random.nextBoolean()
                              ? Optional.<Credentials>empty()
                              : Optional.of(new Credentials(word.apply(5),
                                                            random.nextBoolean()
                                                            ? Optional.<String>empty()
                                                            : Optional.of(word.apply(8))));
            var id = random.nextBoolean()
                     ? Either.<String, Integer>left(word.apply(6))
                     : Either.<String, Integer>right(random.nextInt());
            apps.add(new App(word.apply(4),
                             new Server(word.apply(10), random.nextInt(65536)),
                             new Extras(List.copyOf(ports), credentials, id)));
        }
        return apps;
    }

    private static String randomWord(Random random, int length) {
        var builder = new StringBuilder();
        for (int i = 0; i < length; i++) {
            builder.append((char) ('a' + random.nextInt(26)));
        }
        return builder.toString();
    }
}
