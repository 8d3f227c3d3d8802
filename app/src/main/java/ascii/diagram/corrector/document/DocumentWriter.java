package ascii.diagram.corrector.document;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Writes corrected documents back to disk, optionally keeping a backup of the previous content.
 */
public class DocumentWriter {

    static final String BACKUP_SUFFIX = ".bak";

    public void write(Path target, DocumentText document, boolean backup) {
        if (target == null || document == null) {
            throw new IllegalArgumentException("target and document must be provided");
        }
        try {
            if (backup && Files.exists(target)) {
                Files.copy(target, backupPath(target), StandardCopyOption.REPLACE_EXISTING);
            }
            Files.writeString(target, document.render(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException ex) {
            throw new DocumentIoException("Failed to write to file: " + target, ex);
        }
    }

    public static Path backupPath(Path target) {
        return target.resolveSibling(target.getFileName() + BACKUP_SUFFIX);
    }
}
