package org.iomclient.manager;

import org.apache.commons.io.FileUtils;
import org.iomclient.broker.BrokerException;
import org.iomclient.broker.fake.FakeEngine;
import org.iomclient.data.TransferResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class FileTransferManagerTest {

    @TempDir
    File localDir;

    private FakeEngine engine;
    private FileTransferManager transfer;

    @BeforeEach
    void openSession() throws BrokerException {
        engine = new FakeEngine()
                .setChunkLimit(4)
                .addDirectory("/data")
                .putFile("/data/report.txt", "quarterly report");
        SessionManager session = FakeSessions.openWithPaths(engine);
        transfer = new FileTransferManager(session, new SubmittedRemoteFileInfo(new CodeSubmitter(session, null)));
    }

    private File localFile(String name, String content) throws IOException {
        File file = new File(localDir, name);
        FileUtils.writeStringToFile(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    void testUpload_toFile() throws BrokerException, IOException {
        // Given
        File local = localFile("notes.txt", "some notes to upload");

        // When
        TransferResult result = transfer.upload(local, "/data/notes.txt", true, "");

        // Then
        assertTrue(result.isSuccess());
        assertEquals(FileTransferManager.UPLOADED, result.getMessage());
        assertEquals("some notes to upload", engine.getFileText("/data/notes.txt"));
        assertEquals("", engine.getFileOptions("/data/notes.txt"));
    }

    @Test
    void testUpload_intoDirectoryAppendsName() throws BrokerException, IOException {
        File local = localFile("notes.txt", "abc");

        TransferResult result = transfer.upload(local, "/data", true, "");

        assertTrue(result.isSuccess());
        assertEquals("abc", engine.getFileText("/data/notes.txt"));
    }

    @Test
    void testUpload_intoDirectoryWhereNameIsDirectory() throws BrokerException, IOException {
        // Given: The joined target is itself a server directory
        engine.addDirectory("/data/notes.txt");
        File local = localFile("notes.txt", "abc");

        // When
        TransferResult kept = transfer.upload(local, "/data", false, "");
        TransferResult replaced = transfer.upload(local, "/data", true, "");

        // Then: Nothing is written over the directory
        assertFalse(kept.isSuccess());
        assertEquals("File /data/notes.txt is a directory.", kept.getMessage());
        assertFalse(replaced.isSuccess());
        assertNull(engine.getFile("/data/notes.txt"));
    }

    @Test
    void testUpload_permission() throws BrokerException, IOException {
        File local = localFile("run.sh", "echo hi");

        transfer.upload(local, "/data/run.sh", true, "A::u::rwx,A::g::r-x");

        assertEquals("PERMISSION='A::u::rwx,A::g::r-x'", engine.getFileOptions("/data/run.sh"));
    }

    @Test
    void testUpload_existingWithoutOverwrite() throws BrokerException, IOException {
        // Given
        File local = localFile("report.txt", "new content");

        // When
        TransferResult direct = transfer.upload(local, "/data/report.txt", false, "");
        TransferResult intoDirectory = transfer.upload(local, "/data/", false, "");

        // Then: Server file untouched
        assertFalse(direct.isSuccess());
        assertEquals("File /data/report.txt exists and overwrite was set to False. Upload was stopped.",
                direct.getMessage());
        assertFalse(intoDirectory.isSuccess());
        assertEquals("quarterly report", engine.getFileText("/data/report.txt"));
    }

    @Test
    void testUpload_existingWithOverwrite() throws BrokerException, IOException {
        File local = localFile("report.txt", "new content");

        assertTrue(transfer.upload(local, "/data/report.txt", true, "").isSuccess());
        assertEquals("new content", engine.getFileText("/data/report.txt"));
    }

    @Test
    void testUpload_localMissing() throws BrokerException, IOException {
        File missing = new File(localDir, "missing.txt");

        TransferResult result = transfer.upload(missing, "/data/missing.txt", true, "");

        assertFalse(result.isSuccess());
        assertEquals("File " + missing + " does not exist.", result.getMessage());
        assertNull(engine.getFile("/data/missing.txt"));
    }

    @Test
    void testUpload_localDirectory() throws BrokerException, IOException {
        TransferResult result = transfer.upload(localDir, "/data/x", true, "");

        assertFalse(result.isSuccess());
        assertEquals("File " + localDir + " is a directory.", result.getMessage());
    }

    @Test
    void testDownload_toFile() throws BrokerException, IOException {
        // Given
        File target = new File(localDir, "copy.txt");

        // When
        TransferResult result = transfer.download(target, "/data/report.txt", true);

        // Then
        assertTrue(result.isSuccess());
        assertEquals(FileTransferManager.DOWNLOADED, result.getMessage());
        assertEquals("quarterly report", FileUtils.readFileToString(target, StandardCharsets.UTF_8));
    }

    @Test
    void testDownload_intoDirectoryAppendsName() throws BrokerException, IOException {
        TransferResult result = transfer.download(localDir, "/data/report.txt", true);

        assertTrue(result.isSuccess());
        assertEquals("quarterly report",
                FileUtils.readFileToString(new File(localDir, "report.txt"), StandardCharsets.UTF_8));
    }

    @Test
    void testDownload_remoteMissing() throws BrokerException, IOException {
        TransferResult result = transfer.download(new File(localDir, "x.txt"), "/data/none.txt", true);

        assertFalse(result.isSuccess());
        assertEquals("File /data/none.txt does not exist.", result.getMessage());
        assertFalse(new File(localDir, "x.txt").exists());
    }

    @Test
    void testDownload_remoteDirectory() throws BrokerException, IOException {
        TransferResult result = transfer.download(localDir, "/data", true);

        assertFalse(result.isSuccess());
        assertEquals("File /data is a directory.", result.getMessage());
    }

    @Test
    void testDownload_existingLocalWithoutOverwrite() throws BrokerException, IOException {
        // Given
        File existing = localFile("report.txt", "local edits");

        // When
        TransferResult result = transfer.download(existing, "/data/report.txt", false);

        // Then
        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().endsWith("exists and overwrite was set to False. Download was stopped."));
        assertEquals("local edits", FileUtils.readFileToString(existing, StandardCharsets.UTF_8));
    }

    @Test
    void testTransfer_usesGivenFileInfo() throws BrokerException, IOException {
        // Given: File state comes from the injected lookup only
        SessionManager session = FakeSessions.openWithPaths(engine);
        FileTransferManager manager = new FileTransferManager(session, path -> RemoteFileInfo.FileState.DIRECTORY);

        // When
        TransferResult result = manager.download(new File(localDir, "r.txt"), "/data/report.txt", true);

        // Then
        assertFalse(result.isSuccess());
        assertEquals("File /data/report.txt is a directory.", result.getMessage());
    }
}
