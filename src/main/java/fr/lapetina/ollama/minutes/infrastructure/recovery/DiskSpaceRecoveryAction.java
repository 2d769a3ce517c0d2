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
 * Succeeds when every existing work directory has at least the minimum usable space.
 */
public final class DiskSpaceRecoveryAction implements RecoveryAction {

    private static final Logger log = LoggerFactory.getLogger(DiskSpaceRecoveryAction.class);

    private final List<Path> directories;
    private final long minFreeBytes;

    public DiskSpaceRecoveryAction(List<Path> directories, long minFreeBytes) {
        this.directories = List.copyOf(directories);
        this.minFreeBytes = minFreeBytes;
    }

    @Override
    public String id() {
        return "disk_space_check";
    }

    @Override
    public String description() {
        return "Check available disk space";
    }

    @Override
    public int priority() {
        return 9;
    }

    @Override
    public ErrorType errorType() {
        return ErrorType.FILESYSTEM;
    }

    @Override
    public boolean attempt(ErrorInfo errorInfo) throws IOException {
        boolean checked = false;
        for (Path dir : directories) {
            Path target = Files.exists(dir) ? dir : dir.toAbsolutePath().getParent();
            if (target == null || !Files.exists(target)) {
                continue;
            }
            long usable = Files.getFileStore(target).getUsableSpace();
            if (usable < minFreeBytes) {
                log.warn("Low disk space: path={}, usableBytes={}, requiredBytes={}", target, usable, minFreeBytes);
                return false;
            }
            checked = true;
        }
        return checked;
    }
}
