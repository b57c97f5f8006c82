package org.iomclient.manager;

import java.io.File;
import java.io.IOException;

import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.iomclient.broker.BrokerException;
import org.iomclient.data.TransferResult;

/**
 * Moves whole files between the local file system and the server through
 * binary streams. Policy violations are returned as a failed
 * {@link TransferResult}, never thrown.
 */
public class FileTransferManager {

    private static final Logger LOG = LogManager.getLogger(FileTransferManager.class.getName());

    static final String UPLOADED = "File successfully written using FileService.";
    static final String DOWNLOADED = "File successfully read using FileService.";

    private final SessionManager session;
    private final RemoteFileInfo fileInfo;

    public FileTransferManager(SessionManager session, RemoteFileInfo fileInfo) {
        this.session = session;
        this.fileInfo = fileInfo;
    }

    /**
     * Upload a local file.
     *
     * @param remotePath server file, or an existing server directory to upload into
     * @param overwrite  replace an existing server file
     * @param permission permission string of the fileref, empty for the server default
     */
    public TransferResult upload(File localFile, String remotePath, boolean overwrite, String permission)
            throws BrokerException, IOException {
        if (!localFile.exists()) {
            return TransferResult.failed("File " + localFile + " does not exist.");
        }
        if (localFile.isDirectory()) {
            return TransferResult.failed("File " + localFile + " is a directory.");
        }

        String target = remotePath;
        RemoteFileInfo.FileState state = fileInfo.stat(remotePath);
        if (state == RemoteFileInfo.FileState.DIRECTORY) {
            target = joinRemote(remotePath, localFile.getName());
            state = fileInfo.stat(target);
            if (state == RemoteFileInfo.FileState.DIRECTORY) {
                return TransferResult.failed("File " + target + " is a directory.");
            }
        }
        if (state == RemoteFileInfo.FileState.FILE && !overwrite) {
            LOG.warn("Upload of {} stopped, {} exists", localFile, target);
            return TransferResult.failed("File " + target + " exists and overwrite was set to False. Upload was stopped.");
        }

        String options = permission == null || permission.isEmpty() ? "" : "PERMISSION='" + permission + "'";
        byte[] content = FileUtils.readFileToByteArray(localFile);
        session.writeFile(target, content, options);

        LOG.info("Uploaded {} ({} bytes) to {}", localFile, content.length, target);
        return TransferResult.ok(UPLOADED);
    }

    /**
     * Download a server file.
     *
     * @param localFile local file, or an existing local directory to download into
     * @param overwrite replace an existing local file
     */
    public TransferResult download(File localFile, String remotePath, boolean overwrite)
            throws BrokerException, IOException {
        RemoteFileInfo.FileState state = fileInfo.stat(remotePath);
        if (state == RemoteFileInfo.FileState.MISSING) {
            return TransferResult.failed("File " + remotePath + " does not exist.");
        }
        if (state == RemoteFileInfo.FileState.DIRECTORY) {
            return TransferResult.failed("File " + remotePath + " is a directory.");
        }

        File target = localFile.isDirectory()
                ? new File(localFile, session.getWorkspacePaths().baseName(remotePath))
                : localFile;
        if (target.exists() && !overwrite) {
            LOG.warn("Download of {} stopped, {} exists", remotePath, target);
            return TransferResult.failed("File " + target + " exists and overwrite was set to False. Download was stopped.");
        }

        byte[] content = session.readFile(remotePath);
        FileUtils.writeByteArrayToFile(target, content);

        LOG.info("Downloaded {} ({} bytes) to {}", remotePath, content.length, target);
        return TransferResult.ok(DOWNLOADED);
    }

    private String joinRemote(String directory, String name) {
        String separator = session.getWorkspacePaths().getHostSeparator();
        return directory.endsWith(separator) ? directory + name : directory + separator + name;
    }
}
