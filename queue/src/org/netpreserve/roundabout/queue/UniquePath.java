package org.netpreserve.roundabout.queue;

import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.RandomBasedGenerator;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Makes sure a freshly created disk queue never shares a file with an existing one.
 */
public final class UniquePath {
    private static final RandomBasedGenerator uuidGenerator = Generators.randomBasedGenerator();

    private UniquePath() {
    }

    public static <T> QueueOpener<T> wrap(QueueOpener<T> opener) {
        return wrap(opener, () -> uuidGenerator.generate().toString().replace("-", ""));
    }

    /**
     * Returns an opener which appends "-" and a suffix to the requested path, appending more suffixes until the
     * resulting path doesn't exist.
     */
    public static <T> QueueOpener<T> wrap(QueueOpener<T> opener, Supplier<String> suffixes) {
        return base -> {
            Path path = withSuffix(base, suffixes.get());
            while (Files.exists(path)) {
                path = withSuffix(path, suffixes.get());
            }
            return opener.open(path);
        };
    }

    private static Path withSuffix(Path path, String suffix) {
        return path.resolveSibling(path.getFileName() + "-" + suffix);
    }
}
