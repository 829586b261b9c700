package work.lcod.manifest.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;
import work.lcod.manifest.support.ImportTestSupport;

class MainTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    @Test
    void printsResultAndExitsZero() throws Exception {
        var out = new StringWriter();
        var cmd = Main.commandLine();
        cmd.setOut(new PrintWriter(out));

        int exit = cmd.execute("--catalog", ImportTestSupport.catalogPath().toString(), "v1#Namespace#team-a");

        assertEquals(0, exit);
        var json = JSON.readTree(out.toString());
        assertEquals("success", json.get("status").asText());
        assertEquals("team-a", json.at("/importedResources/0/state/value/object/metadata/name").asText());
    }

    @Test
    void failedImportExitsOne() throws Exception {
        var out = new StringWriter();
        var cmd = Main.commandLine();
        cmd.setOut(new PrintWriter(out));

        int exit = cmd.execute("-c", ImportTestSupport.catalogPath().toString(), "--timeout", "30s", "not-an-id");

        assertEquals(1, exit);
        var json = JSON.readTree(out.toString());
        assertEquals("Failed to parse import ID", json.at("/diagnostics/0/summary").asText());
    }

    @Test
    void rejectsBadArguments() {
        var err = new StringWriter();
        var cmd = Main.commandLine();
        cmd.setErr(new PrintWriter(err));

        int missingCatalog = cmd.execute("-c", "no/such/catalog.yaml", "v1#Secret#default#token");
        int badTimeout = cmd.execute("-c", ImportTestSupport.catalogPath().toString(), "--timeout", "soon", "v1#Secret#a#b");

        assertEquals(CommandLine.ExitCode.USAGE, missingCatalog);
        assertEquals(CommandLine.ExitCode.USAGE, badTimeout);
        assertTrue(err.toString().contains("Catalog not found"), err.toString());
        assertTrue(err.toString().contains("Invalid duration: soon"), err.toString());
    }

    @Test
    void printsVersion() {
        var out = new StringWriter();
        var cmd = Main.commandLine();
        cmd.setOut(new PrintWriter(out));

        assertEquals(0, cmd.execute("--version"));
        assertTrue(out.toString().startsWith("manifest-import "), out.toString());
    }
}
