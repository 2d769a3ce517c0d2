package fr.lapetina.ollama.minutes.infrastructure.recovery;

import fr.lapetina.ollama.minutes.domain.recovery.ErrorInfo;
import fr.lapetina.ollama.minutes.domain.recovery.ErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Recreates missing work directories.
 */
public final class CreateDirectoriesRecoveryAction implements RecoveryAction {

    private static final Logger log = LoggerFactory.getLogger(CreateDirectoriesRecoveryAction.class);

    private final List<Path> directories;

    public CreateDirectoriesRecoveryAction(List<Path> directories) {
        this.directories = List.copyOf(directories);
    }

    @Override
    public String id() {
        return "create_work_directories";
    }

    @Override
    public String description() {
        return "Create missing work directories";
    }

    @Override
    public int priority() {
        return 8;
    }

    @Override
    public ErrorType errorType() {
        return ErrorType.FILESYSTEM;
    }

    @Override
    public boolean attempt(ErrorInfo errorInfo) throws IOException {
        if (directories.isEmpty()) {
            return false;
        }
        for (Path dir : directories) {
            if (!Files.isDirectory(dir)) {
                Files.createDirectories(dir);
                log.info("Work directory created: path={}", dir);
            }
        }
        return true;
    }
}
