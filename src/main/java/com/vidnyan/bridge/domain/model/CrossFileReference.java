package com.vidnyan.bridge.domain.model;

/**
 * A symbolic dependency from one file of a batch to a path or asset.
 * {@code resolvedFile} is the batch file the target resolves to, or null.
 */
public record CrossFileReference(
    String sourceFile,
    String targetPath,
    ReferenceKind kind,
    String resolvedFile
) {

    public enum ReferenceKind {
        IMPORT,         // use declaration
        SHADER_HANDLE   // shader asset loaded by path
    }

    public static CrossFileReference of(String sourceFile, String targetPath, ReferenceKind kind) {
        return new CrossFileReference(sourceFile, targetPath, kind, null);
    }

    public CrossFileReference resolvedTo(String file) {
        return new CrossFileReference(sourceFile, targetPath, kind, file);
    }

    public boolean isResolved() {
        return resolvedFile != null;
    }
}
