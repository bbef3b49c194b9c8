package psp.encounter.output;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class BinCacheTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  private static Encounter e10() {
    List<AngularBin> bins = Arrays.asList(
        new AngularBin(358.75, 359.9995, 4, 120),
        new AngularBin(0.0005, 1.2, 0, 118),
        new AngularBin(1.2, 2.3, 150, 60));
    return new Encounter("E10", Instant.parse("2021-11-21T08:23:00Z"), 0.4, 154, 298, 3, bins);
  }

  @Test
  public void load_missingFileIsEmpty() throws IOException {
    BinCache cache = BinCache.load(new File(folder.getRoot(), "absent.json"));
    assertTrue(cache.getEncounterIds().isEmpty());
    assertNull(cache.getEncounter("E10"));
  }

  @Test
  public void store_roundTripsThroughFile() throws IOException {
    File file = new File(folder.getRoot(), "cache/ham_bin_data.json");
    BinCache cache = BinCache.load(file);
    assertTrue(cache.store(e10()));
    assertTrue(file.exists());

    BinCache reread = BinCache.load(file);
    assertTrue(reread.contains("E10"));
    Encounter read = reread.getEncounter("E10");
    Encounter original = e10();
    assertEquals(original.getPerihelion(), read.getPerihelion());
    assertEquals(0.4, read.getPerihelionLon(), 1E-12);
    assertEquals(154, read.getDetectionCount());
    assertEquals(298, read.getReferenceCount());
    assertEquals(3, read.getWindowDays());
    assertEquals(3, read.getBins().size());
    for (int i = 0; i < 3; ++i) {
      AngularBin was = original.getBins().get(i);
      AngularBin now = read.getBins().get(i);
      assertEquals(was.getStartLon(), now.getStartLon(), 1E-3);
      assertEquals(was.getEndLon(), now.getEndLon(), 1E-3);
      assertEquals(was.getHamCount(), now.getHamCount());
      assertEquals(was.getAllCount(), now.getAllCount());
      assertEquals(was.getHamFrac(), now.getHamFrac(), 1E-3);
    }
    assertTrue(BinCache.compare(original, read, 1E-3).isEmpty());
  }

  @Test
  public void store_existingEntryIsNotOverwritten() throws IOException {
    File file = new File(folder.getRoot(), "ham_bin_data.json");
    BinCache cache = BinCache.load(file);
    assertTrue(cache.store(e10()));
    Encounter changed = new Encounter("E10", Instant.parse("2021-11-21T08:23:00Z"), 0.4, 1, 2,
        3, Arrays.asList(new AngularBin(5., 6., 1, 1)));
    assertFalse(cache.store(changed));
    assertEquals(3, BinCache.load(file).getEncounter("E10").getBins().size());
  }

  @Test
  public void compare_reportsShiftedFractionOnly() {
    Encounter cached = e10();
    Encounter computed = new Encounter("E10", cached.getPerihelion(), 0.4, 154, 298, 3,
        Arrays.asList(
            new AngularBin(358.75, 0.0, 4, 120),
            new AngularBin(359.9998, 1.2, 0, 118),
            new AngularBin(1.2, 2.3, 150, 60, 2.6)));
    List<CacheDiscrepancy> discrepancies = BinCache.compare(cached, computed, 1E-3);
    assertEquals(1, discrepancies.size());
    CacheDiscrepancy discrepancy = discrepancies.get(0);
    assertEquals(2, discrepancy.getBinIndex());
    assertEquals(BinCache.HAM_FRAC, discrepancy.getField());
    assertEquals(150. / 61., discrepancy.getCachedValue(), 1E-12);
    assertEquals(2.6, discrepancy.getComputedValue(), 1E-12);
  }

  @Test
  public void compare_reportsBinCountOnce() {
    Encounter cached = e10();
    Encounter computed = new Encounter("E10", cached.getPerihelion(), 0.4, 154, 298, 3,
        cached.getBins().subList(0, 2));
    List<CacheDiscrepancy> discrepancies = BinCache.compare(cached, computed, 1E-3);
    assertEquals(1, discrepancies.size());
    assertEquals(-1, discrepancies.get(0).getBinIndex());
    assertEquals(BinCache.N_BINS, discrepancies.get(0).getField());
  }

  @Test
  public void load_readsSlashPerihelionAndOptionalFields() throws IOException {
    File file = folder.newFile("legacy.json");
    String json = "{\"E04\": {\"perihelion\": \"2020/01/29 09:37:00.000\","
        + " \"n_detections\": 7,"
        + " \"bins\": [{\"start_lon\": 10.0, \"end_lon\": 11.0,"
        + " \"ham_count\": 3, \"all_count\": 5}]}}";
    Files.write(file.toPath(), json.getBytes(StandardCharsets.UTF_8));
    Encounter read = BinCache.load(file).getEncounter("E04");
    assertEquals(Instant.parse("2020-01-29T09:37:00Z"), read.getPerihelion());
    assertEquals(-1, read.getReferenceCount());
    assertTrue(Double.isNaN(read.getPerihelionLon()));
    assertEquals(0.5, read.getBins().get(0).getHamFrac(), 1E-12);
  }

  @Test(expected = IOException.class)
  public void load_entryWithoutBinsThrows() throws IOException {
    File file = folder.newFile("broken.json");
    Files.write(file.toPath(),
        "{\"E05\": {\"perihelion\": \"2020-06-07T08:23:00Z\"}}".getBytes(StandardCharsets.UTF_8));
    BinCache.load(file);
  }

  @Test(expected = IOException.class)
  public void load_nonObjectThrows() throws IOException {
    File file = folder.newFile("array.json");
    Files.write(file.toPath(), "[1, 2]".getBytes(StandardCharsets.UTF_8));
    BinCache.load(file);
  }
}
