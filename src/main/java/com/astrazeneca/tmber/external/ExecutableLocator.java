package com.astrazeneca.tmber.external;

import com.astrazeneca.tmber.exception.ExecutableNotFoundException;

import java.io.File;
import java.util.regex.Pattern;

/**
 * Looks up executables in the directories of a search path (PATH by default).
 */
public class ExecutableLocator {
    private final String searchPath;

    public ExecutableLocator() {
        this(System.getenv("PATH"));
    }

    public ExecutableLocator(String searchPath) {
        this.searchPath = searchPath == null ? "" : searchPath;
    }

    /**
     * @param command name of the executable
     * @return absolute path of the first match or null if nothing was found
     */
    public String find(String command) {
        for (String dir : searchPath.split(Pattern.quote(File.pathSeparator))) {
            if (dir.isEmpty()) {
                continue;
            }
            File candidate = new File(dir, command);
            if (candidate.isFile() && candidate.canExecute()) {
                return candidate.getAbsolutePath();
            }
        }
        return null;
    }

    /**
     * @param command name of the executable
     * @return absolute path of the first match
     * @throws ExecutableNotFoundException if the command is not in the search path
     */
    public String locate(String command) {
        String path = find(command);
        if (path == null) {
            throw new ExecutableNotFoundException(command);
        }
        return path;
    }

    /**
     * @param commands names to try in order
     * @return absolute path of the first command found
     * @throws ExecutableNotFoundException naming all the commands if none is in the search path
     */
    public String locateAny(String... commands) {
        for (String command : commands) {
            String path = find(command);
            if (path != null) {
                return path;
            }
        }
        throw new ExecutableNotFoundException(String.join(" or ", commands));
    }
}
