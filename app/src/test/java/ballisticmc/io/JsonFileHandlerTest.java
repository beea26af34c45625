package ballisticmc.io;

import ballisticmc.domain.simulation.SimulationSnapshot;
import ballisticmc.domain.simulation.SimulationSnapshot.SegmentCount;
import ballisticmc.domain.simulation.SimulationSnapshot.WaypointRecord;
import ballisticmc.domain.trajectory.TrajectoryState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileHandlerTest {

    @TempDir
    Path tempDir;

    private final JsonFileHandler handler = new JsonFileHandler();

    @Test
    @DisplayName("Un snapshot escrito y leído de nuevo es igual al original")
    void snapshot_survivesDisk() throws IOException {
        // --- ARRANGE ---
        SimulationSnapshot snapshot = new SimulationSnapshot(
                List.of(new SegmentCount(0, 1, 0.0, 0.0, 2.0, 0.0, 12L),
                        new SegmentCount(1, 2, 2.0, 1.0, 0.0, 1.0, 7L)),
                List.of(List.of(
                        new WaypointRecord(4, 1.0, 0.5, 0.0, TrajectoryState.INJECTING, 0),
                        new WaypointRecord(4, 0.3125, 0.6, 1.0, TrajectoryState.ABSORBED, 1),
                        new WaypointRecord(5, 1.0, 0.7, 0.9, TrajectoryState.PROPAGATE, null))));
        Path path = tempDir.resolve("nested/dir/snapshot.json");

        // --- ACT ---
        handler.writeToFile(snapshot, path);
        SimulationSnapshot loaded = handler.readFromFile(path, SimulationSnapshot.class);

        // --- ASSERT ---
        assertTrue(Files.exists(path), "Se crean los directorios intermedios");
        assertEquals(snapshot, loaded);
    }

    @Test
    @DisplayName("Leer un fichero inexistente lanza IOException")
    void readMissingFile_throws() {
        assertThrows(IOException.class, () -> handler.readFromFile(tempDir.resolve("missing.json"), SimulationSnapshot.class));
    }

    @Test
    @DisplayName("Un JSON malformado lanza IOException")
    void readMalformed_throws() throws IOException {
        Path path = tempDir.resolve("broken.json");
        Files.writeString(path, "{ \"counts\": [ ");

        assertThrows(IOException.class, () -> handler.readFromFile(path, SimulationSnapshot.class));
    }
}
