package io.github.yok.prismlink.util;

import com.google.common.base.Preconditions;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Generated;
import lombok.extern.slf4j.Slf4j;

/**
 * Utility for rendering file paths for logs.
 *
 * <p>
 * Paths under the current working directory are rendered relative to it; anything else is
 * rendered as an absolute normalized path.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class LogPathUtil {

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private LogPathUtil() {
        throw new AssertionError("No io.github.yok.prismlink.util.LogPathUtil instances for you!");
    }

    /**
     * Renders a file path for logs.
     *
     * @param file file to render
     * @return path string rendered for logs
     * @throws NullPointerException if {@code file} is {@code null}
     */
    public static String renderPathForLog(Path file) {
        Preconditions.checkNotNull(file, "file must not be null");

        Path base = Paths.get(System.getProperty("user.dir")).toAbsolutePath().normalize();
        Path abs = file.toAbsolutePath().normalize();

        if (abs.startsWith(base) && !abs.equals(base)) {
            String rel = base.relativize(abs).toString();
            log.trace("Rendered relative log path. base={}, abs={}, rel={}", base, abs, rel);
            return rel;
        }
        return abs.toString();
    }
}
