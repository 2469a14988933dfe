package org.dxworks.fortframe;

import java.nio.file.Path;
import java.util.Optional;

public class SourceFormDetector {

    public static Optional<SourceForm> detectSourceForm(Path filePath, FortframeConfig config) {
        String extension = extensionOf(filePath);
        if (extension.isEmpty()) {
            return Optional.empty();
        }

        // Extensions are case sensitive: .F90 and .f90 are both free form, .F is fixed
        if (config.getExtensions().contains(extension)) {
            return Optional.of(SourceForm.FREE);
        } else if (config.getFixedExtensions().contains(extension)) {
            return Optional.of(SourceForm.FIXED);
        }

        return Optional.empty();
    }

    private static String extensionOf(Path filePath) {
        String fileName = filePath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot + 1);
    }
}
