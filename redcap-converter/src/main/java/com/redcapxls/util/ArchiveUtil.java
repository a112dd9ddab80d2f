package com.redcapxls.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import net.lingala.zip4j.ZipFile;
import net.lingala.zip4j.exception.ZipException;
import net.lingala.zip4j.model.ZipParameters;
import net.lingala.zip4j.model.enums.AesKeyStrength;
import net.lingala.zip4j.model.enums.EncryptionMethod;

/**
 * Creates ZIP archives, with optional AES password protection, using Zip4j.
 */
public class ArchiveUtil {

    /**
     * Archive files into a new ZIP archive. Each file is stored under its own
     * file name at the root of the archive.
     *
     * @param sourceFiles files to archive, all of which must exist
     * @param zipPath path of the archive to create, which must not exist yet
     * @param password optional password, null or blank for no encryption
     * @throws IOException if a source file is missing or archiving fails
     */
    public static void archiveFiles(List<Path> sourceFiles, Path zipPath, String password) throws IOException {
        LoggingUtil.debug("Creating ZIP archive: " + zipPath + " with " + sourceFiles.size() + " file(s)");

        for (Path sourceFile : sourceFiles) {
            if (!Files.isRegularFile(sourceFile)) {
                throw new IOException("File to archive does not exist: " + sourceFile);
            }
        }

        ZipParameters zipParameters = new ZipParameters();
        boolean encrypted = password != null && !password.trim().isEmpty();
        if (encrypted) {
            zipParameters.setEncryptFiles(true);
            zipParameters.setEncryptionMethod(EncryptionMethod.AES);
            zipParameters.setAesKeyStrength(AesKeyStrength.KEY_STRENGTH_256);
        }

        try (ZipFile zipFile = encrypted
                ? new ZipFile(zipPath.toFile(), password.toCharArray())
                : new ZipFile(zipPath.toFile())) {
            for (Path sourceFile : sourceFiles) {
                String fileNameInZip = sourceFile.getFileName().toString();
                zipParameters.setFileNameInZip(fileNameInZip);
                zipFile.addFile(sourceFile.toFile(), zipParameters);
                LoggingUtil.debug("Added to archive: " + fileNameInZip);
            }
        } catch (ZipException e) {
            throw new IOException("Failed to create archive " + zipPath + ": " + e.getMessage(), e);
        }

        LoggingUtil.debug("ZIP archive created" + (encrypted ? " with password protection" : "") + ": " + zipPath);
    }

    /**
     * Test if a ZIP file is password protected
     *
     * @param zipPath Path to the ZIP file
     * @return true if the file is password protected
     */
    public static boolean isPasswordProtected(Path zipPath) throws IOException {
        try (ZipFile zipFile = new ZipFile(zipPath.toFile())) {
            return zipFile.isEncrypted();
        } catch (ZipException e) {
            throw new IOException("Cannot read archive " + zipPath + ": " + e.getMessage(), e);
        }
    }
}
