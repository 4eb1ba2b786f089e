package edu.washu.tag.extractor.pathosys.processing;

import static edu.washu.tag.extractor.pathosys.util.Constants.IDENTITY_PATH_RULE;

import java.nio.file.Path;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Rewrites slide and thumbnail paths according to a path transform rule.
 *
 * <p>Rules come in three forms:
 * 1. Blank, or {@code <>}: paths are left unchanged.
 * 2. {@code old:new}: a path starting with {@code old}, once normalized, has that prefix replaced by {@code new}.
 *    Paths without the prefix are left unchanged. Only the first {@code :} separates the two prefixes.
 * 3. Anything else is a mount point directory. Relative paths are resolved against it and absolute paths
 *    are re-rooted under it.
 */
@Component
public class PathTransformer {

    private static final Logger logger = LoggerFactory.getLogger(PathTransformer.class);

    private static final char PREFIX_SEPARATOR = ':';
    private static final String CURRENT_DIRECTORY = ".";

    /**
     * Transforms one path.
     *
     * @param knownPath Path as found in the slide table
     * @param rule      Path transform rule
     * @return The transformed path
     */
    public String transform(String knownPath, String rule) {
        if (StringUtils.isBlank(rule) || IDENTITY_PATH_RULE.equals(rule.strip())) {
            return knownPath;
        }

        int separator = rule.indexOf(PREFIX_SEPARATOR);
        if (separator >= 0) {
            String oldPrefix = rule.substring(0, separator);
            String newPrefix = rule.substring(separator + 1);
            String source = normalize(knownPath);
            if (!source.startsWith(oldPrefix)) {
                logger.warn("Prefix '{}' not found in '{}', path left unchanged", oldPrefix, knownPath);
                return knownPath;
            }
            return normalize(newPrefix + source.substring(oldPrefix.length()));
        }

        Path mountPoint = Path.of(rule);
        Path source = Path.of(knownPath);
        Path relative = source.isAbsolute() ? source.getRoot().relativize(source) : source;
        return normalize(mountPoint.resolve(relative).toString());
    }

    /**
     * Normalizes a path string: collapses repeated separators and drops trailing separators and {@code .} segments.
     * Unlike {@link Path#normalize()}, {@code ..} segments are kept.
     *
     * @param path Path string
     * @return Normalized path string
     */
    static String normalize(String path) {
        Path parsed = Path.of(path);
        Path result = parsed.getRoot();
        for (Path name : parsed) {
            if (CURRENT_DIRECTORY.equals(name.toString())) {
                continue;
            }
            result = result == null ? name : result.resolve(name);
        }
        return result == null ? CURRENT_DIRECTORY : result.toString();
    }
}
