package arima;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    @TempDir
    Path dir;

    @Test
    public void horizonCoveringEveryRegressorRowIsRejected() throws IOException {
        Path csv = dir.resolve("series.csv");
        Files.writeString(csv, "y,x\n1,2\n2,3\n3,5\n4,8\n");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> Main.run(new String[] {csv.toString(), "1,0,0", "0,0,0,0", "4"}));
        assertTrue(e.getMessage().contains("Horizon 4"), e.getMessage());

        assertThrows(IllegalArgumentException.class,
            () -> Main.run(new String[] {csv.toString(), "1,0,0", "0,0,0,0", "9"}));
    }
}
