package org.pywalrus.transpiler;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Hands out identifier-safe strings that the same instance never repeats. A conversion
 * run owns one generator and passes it to every context it creates.
 */
public final class UniqueNameGenerator {

    private final Supplier<String> source;
    private final Set<String> issued = new HashSet<>();

    private UniqueNameGenerator(Supplier<String> source) {
        this.source = source;
    }

    /**
     * Random UUIDs without dashes.
     */
    public static UniqueNameGenerator random() {
        return new UniqueNameGenerator(() -> compact(UUID.randomUUID()));
    }

    /**
     * UUID-shaped names from a seeded random sequence, identical across runs with the same seed.
     */
    public static UniqueNameGenerator seeded(long seed) {
        Random random = new Random(seed);
        return new UniqueNameGenerator(() -> compact(new UUID(random.nextLong(), random.nextLong())));
    }

    /**
     * {@code 1}, {@code 2}, {@code 3} and so on.
     */
    public static UniqueNameGenerator sequential() {
        int[] counter = {0};
        return new UniqueNameGenerator(() -> Integer.toString(++counter[0]));
    }

    public String next() {
        String name = source.get();
        while (!issued.add(name)) {
            name = source.get();
        }
        return name;
    }

    private static String compact(UUID uuid) {
        return uuid.toString().replace("-", "");
    }
}
