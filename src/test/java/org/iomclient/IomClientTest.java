package org.iomclient;

import org.iomclient.broker.BrokerException;
import org.iomclient.broker.fake.FakeEngine;
import org.iomclient.broker.fake.FakeObjectBroker;
import org.iomclient.broker.fake.FakeTable;
import org.iomclient.cli.SessionOptions;
import org.iomclient.data.DataFrame;
import org.iomclient.data.SubmitResult;
import org.iomclient.data.TabularResult;
import org.iomclient.data.TransferResult;
import org.iomclient.manager.SessionManager;
import org.iomclient.manager.util.DatasetOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class IomClientTest {

    private FakeEngine engine;
    private IomClient client;

    @BeforeEach
    void openClient() throws BrokerException {
        engine = new FakeEngine();
        engine.putTable("sashelp.class", new FakeTable(
                        FakeTable.Column.character("Name", 8),
                        FakeTable.Column.numeric("Age"),
                        FakeTable.Column.numeric("Height"))
                .row("Alfred", 14, 69)
                .row("Alice", 13, 56.5)
                .row("Barbara", 13, 65.3));
        client = new IomClient(new SessionOptions(), new FakeObjectBroker(engine), null);
    }

    @AfterEach
    void closeClient() throws BrokerException {
        client.close();
    }

    @Test
    void testConstructor_opensAndDiscoversPaths() throws BrokerException {
        assertEquals(SessionManager.State.OPEN, client.getState());
        assertTrue(client.getSessionId().startsWith("FAKE-WS-"));
        assertEquals("/work/", client.getWorkspacePaths().getWorkPath());
        assertEquals("/", client.getWorkspacePaths().getHostSeparator());
    }

    @Test
    void testSubmit_defaultsToHtml() throws BrokerException {
        // When
        SubmitResult result = client.submit("proc print data=sashelp.class; run;");

        // Then
        assertTrue(result.getListing().contains("<td>Alfred</td>"), result.getListing());
        assertTrue(result.getLog().contains("proc print data=sashelp.class; run;"));
        assertTrue(client.sessionLog().contains("proc print data=sashelp.class; run;"));
    }

    @Test
    void testExist() throws BrokerException {
        assertTrue(client.exist("class", "sashelp"));
        assertFalse(client.exist("class"));
        assertEquals(Arrays.asList("Name", "Age", "Height"),
                Arrays.asList(client.schema("class", "sashelp").keySet().toArray()));
    }

    @Test
    void testWriteThenRead() throws BrokerException, IOException {
        // Given
        DataFrame frame = DataFrame.builder()
                .string("city", "Oslo", "Lima")
                .numeric("population", 709000, 9750000)
                .build();

        // When
        client.write(frame, "cities");
        TabularResult viaCursor = client.read("cities");
        TabularResult viaCsv = client.readCsv("cities");

        // Then
        assertTrue(client.exist("cities"));
        assertEquals(2, viaCursor.getRowCount());
        assertEquals("Lima", viaCursor.getValue(1, "city"));
        assertEquals(9750000.0, viaCursor.getValue(1, "population"));
        assertEquals(viaCursor.getRows(), viaCsv.getRows());
    }

    @Test
    void testExportThenImportCsv() throws BrokerException {
        // When
        SubmitResult exported = client.exportCsv("class", "sashelp", "/work/class.csv",
                new DatasetOptions().where("Age = 13"), null);
        SubmitResult imported = client.importCsv("/work/class.csv", "teens");

        // Then
        assertFalse(exported.getLog().contains("ERROR"), exported.getLog());
        assertFalse(imported.getLog().contains("ERROR"), imported.getLog());
        assertTrue(engine.getFileText("/work/class.csv").startsWith("Name,Age,Height\nAlice,13,56.5\n"));
        TabularResult teens = client.read("teens");
        assertEquals(2, teens.getRowCount());
        assertEquals("Barbara", teens.getValue(1, "Name"));
        assertEquals(65.3, teens.getValue(1, "Height"));
    }

    @Test
    void testCsvCode_notSubmitted() {
        int before = engine.getSubmissions().size();

        String code = client.importCsvCode("/work/a.csv", "a", null, null);

        assertTrue(code.contains("proc import datafile=csv_file out=a dbms=csv replace;"));
        assertEquals(before, engine.getSubmissions().size());
    }

    @Test
    void testUploadThenDownload(@TempDir File dir) throws BrokerException, IOException {
        // Given
        File local = new File(dir, "data.txt");
        Files.write(local.toPath(), "payload".getBytes(StandardCharsets.UTF_8));
        File copy = new File(dir, "copy.txt");

        // When
        TransferResult up = client.upload(local, "/work");
        TransferResult down = client.download(copy, "/work/data.txt");

        // Then
        assertTrue(up.isSuccess(), up.getMessage());
        assertTrue(down.isSuccess(), down.getMessage());
        assertEquals("payload", new String(Files.readAllBytes(copy.toPath()), StandardCharsets.UTF_8));
    }

    @Test
    void testClose() throws BrokerException {
        client.close();

        assertEquals(SessionManager.State.CLOSED, client.getState());
        assertTrue(engine.getEvents().contains("workspace.close"));
        assertThrows(IllegalStateException.class, () -> client.submit("%put x;"));
    }

    @Test
    void testConstructor_failureReleasesWorkspace() {
        // Given
        FakeEngine failing = new FakeEngine().failOn("language.submit");

        // When
        assertThrows(BrokerException.class,
                () -> new IomClient(new SessionOptions(), new FakeObjectBroker(failing), null));

        // Then
        assertTrue(failing.getEvents().contains("workspace.close"));
        assertTrue(failing.getEvents().contains("connection.close"));
    }

    @Test
    void testConstructor_loadsBrokerByName() throws BrokerException {
        // Given
        Properties configuration = new Properties();
        configuration.setProperty(SessionOptions.BROKER_IMPL, FakeObjectBroker.class.getName());

        // When
        try (IomClient named = new IomClient(new SessionOptions(configuration))) {
            // Then
            assertEquals(SessionManager.State.OPEN, named.getState());
            assertEquals("/work/", named.getWorkspacePaths().getWorkPath());
        }
    }

    @Test
    void testConstructor_noBrokerConfigured() {
        assertThrows(IllegalArgumentException.class, () -> new IomClient(new SessionOptions()));
    }
}
