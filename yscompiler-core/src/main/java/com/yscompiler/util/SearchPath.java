package com.yscompiler.util;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Directories searched for YAMLScript modules.
 *
 * <p>Taken from the {@code YSPATH} environment variable, a colon-separated
 * list. When it is unset the directory of the document being compiled is used,
 * or the working directory for a document read from memory, whose name is
 * exactly {@code /NO-NAME}.</p>
 */
public final class SearchPath {

    public static final String ENV_VAR = "YSPATH";

    /**
     * File name given to a document that was not read from a file.
     */
    public static final String NO_NAME = "/NO-NAME";

    private SearchPath() {
        // Utility class
    }

    public static List<Path> resolve(String base) {
        return resolve(base, System.getenv());
    }

    /**
     * @param base the document's file name, may be null
     * @param env  environment variables
     * @return absolute directories, in search order
     * @throws SearchPathException if {@code YSPATH} is unset and {@code base} is null
     */
    public static List<Path> resolve(String base, Map<String, String> env) {
        String spec = env.get(ENV_VAR);
        if (spec == null) {
            if (base == null) {
                throw new SearchPathException(ENV_VAR + " environment variable not set");
            }
            spec = NO_NAME.equals(base)
                ? cwd().toString()
                : dirname(base).toString();
        }
        // Trailing empty entries are dropped by split; any other empty entry is the working directory
        List<Path> dirs = new ArrayList<>();
        for (String entry : spec.split(":")) {
            dirs.add(abspath(entry));
        }
        return dirs;
    }

    static Path dirname(String file) {
        Path parent = Path.of(file).getParent();
        return parent == null ? Path.of(".") : parent;
    }

    static Path abspath(String path) {
        Path p = Path.of(path);
        return p.isAbsolute() ? p.normalize() : cwd().resolve(p).normalize();
    }

    private static Path cwd() {
        return Path.of("").toAbsolutePath();
    }
}
