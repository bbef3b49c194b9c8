package psp.encounter.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.File;
import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.apache.log4j.Logger;
import psp.encounter.utils.AngularBinUtils;
import psp.encounter.utils.TimeSeriesUtils;

/**
 * Persisted angular bins, one entry per encounter, kept as a JSON object keyed by encounter id:
 *
 * <pre>
 * {"E04": {"perihelion": "2020-01-29T09:37:00Z", "n_detections": 812, "n_bins": 2,
 *          "window_days": 3,
 *          "bins": [{"start_lon": 340.0, "end_lon": 341.0, "ham_count": 3,
 *                    "all_count": 90, "ham_frac": 0.033}, ...]}}
 * </pre>
 *
 * Entries are written once; storing an encounter that is already present is refused. Files
 * written with perihelia in the "yyyy/MM/dd HH:mm:ss.SSS" form are read as well, and the
 * "n_bins" and "window_days" fields are optional on read.
 */
public class BinCache {

  static final String PERIHELION = "perihelion";
  static final String PERIHELION_LON = "perihelion_lon";
  static final String N_DETECTIONS = "n_detections";
  static final String N_REFERENCE = "n_span_measurements";
  static final String N_BINS = "n_bins";
  static final String WINDOW_DAYS = "window_days";
  static final String BINS = "bins";
  static final String START_LON = "start_lon";
  static final String END_LON = "end_lon";
  static final String HAM_COUNT = "ham_count";
  static final String ALL_COUNT = "all_count";
  static final String HAM_FRAC = "ham_frac";

  private static final Logger logger = Logger.getLogger(BinCache.class);

  private static final ObjectMapper MAPPER =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private final File file;
  private final Map<String, Encounter> encounters;

  private BinCache(File file, Map<String, Encounter> encounters) {
    this.file = file;
    this.encounters = encounters;
  }

  /**
   * Read a cache file. A file that does not exist yet gives an empty cache that will be created
   * on the first store.
   *
   * @param file Location of the JSON cache
   * @return Cache holding the file's encounters
   * @throws IOException if the file exists but cannot be read or parsed
   */
  public static BinCache load(File file) throws IOException {
    Map<String, Encounter> encounters = new TreeMap<>();
    if (!file.exists()) {
      logger.info("No bin cache at " + file + ", starting an empty one");
      return new BinCache(file, encounters);
    }
    JsonNode root = MAPPER.readTree(file);
    if (root == null || !root.isObject()) {
      throw new IOException("Bin cache " + file + " does not hold a JSON object");
    }
    Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      encounters.put(field.getKey(), readEncounter(field.getKey(), field.getValue()));
    }
    logger.info("Read " + encounters.size() + " encounters from bin cache " + file);
    return new BinCache(file, encounters);
  }

  private static Encounter readEncounter(String id, JsonNode node) throws IOException {
    JsonNode perihelionNode = node.get(PERIHELION);
    JsonNode binsNode = node.get(BINS);
    if (perihelionNode == null || binsNode == null || !binsNode.isArray()) {
      throw new IOException("Bin cache entry " + id + " lacks " + PERIHELION + " or " + BINS);
    }
    Instant perihelion;
    try {
      perihelion = TimeSeriesUtils.parseTimestamp(perihelionNode.asText());
    } catch (DateTimeParseException e) {
      throw new IOException("Bin cache entry " + id + " has unreadable perihelion "
          + perihelionNode.asText(), e);
    }

    List<AngularBin> bins = new ArrayList<>();
    for (JsonNode binNode : binsNode) {
      int hamCount = binNode.path(HAM_COUNT).asInt();
      int allCount = binNode.path(ALL_COUNT).asInt();
      double hamFrac = binNode.has(HAM_FRAC) ? binNode.get(HAM_FRAC).asDouble()
          : AngularBinUtils.hamFraction(hamCount, allCount);
      bins.add(new AngularBin(binNode.path(START_LON).asDouble(Double.NaN),
          binNode.path(END_LON).asDouble(Double.NaN), hamCount, allCount, hamFrac));
    }
    if (node.has(N_BINS) && node.get(N_BINS).asInt() != bins.size()) {
      logger.warn("Bin cache entry " + id + " declares " + node.get(N_BINS).asInt()
          + " bins but holds " + bins.size());
    }
    return new Encounter(id, perihelion, node.path(PERIHELION_LON).asDouble(Double.NaN),
        node.path(N_DETECTIONS).asInt(), node.path(N_REFERENCE).asInt(-1),
        node.path(WINDOW_DAYS).asInt(0), bins);
  }

  public File getFile() {
    return file;
  }

  public Set<String> getEncounterIds() {
    return Collections.unmodifiableSet(encounters.keySet());
  }

  public boolean contains(String encounterId) {
    return encounters.containsKey(encounterId);
  }

  /**
   * Get the cached bins of an encounter
   *
   * @param encounterId Identifier such as "E10"
   * @return Cached encounter, or null if the cache holds no such entry
   */
  public Encounter getEncounter(String encounterId) {
    return encounters.get(encounterId);
  }

  /**
   * Add an encounter and write the cache file. An encounter already in the cache is never
   * overwritten.
   *
   * @param encounter Encounter to persist
   * @return True if stored, false if an entry with the same id was already present
   * @throws IOException if the cache file cannot be written
   */
  public boolean store(Encounter encounter) throws IOException {
    if (encounters.containsKey(encounter.getId())) {
      logger.warn("Bin cache already holds " + encounter.getId() + "; not overwriting it");
      return false;
    }
    encounters.put(encounter.getId(), encounter);
    save();
    logger.info("Stored " + encounter.getId() + " with " + encounter.getBins().size()
        + " bins in " + file);
    return true;
  }

  private void save() throws IOException {
    ObjectNode root = MAPPER.createObjectNode();
    for (Encounter encounter : encounters.values()) {
      root.set(encounter.getId(), writeEncounter(encounter));
    }
    File parent = file.getAbsoluteFile().getParentFile();
    if (parent != null && !parent.exists() && !parent.mkdirs()) {
      throw new IOException("Could not create directory " + parent);
    }
    MAPPER.writeValue(file, root);
  }

  private static ObjectNode writeEncounter(Encounter encounter) {
    ObjectNode node = MAPPER.createObjectNode();
    node.put(PERIHELION, encounter.getPerihelion().toString());
    if (Double.isFinite(encounter.getPerihelionLon())) {
      node.put(PERIHELION_LON, encounter.getPerihelionLon());
    }
    node.put(N_DETECTIONS, encounter.getDetectionCount());
    if (encounter.getReferenceCount() >= 0) {
      node.put(N_REFERENCE, encounter.getReferenceCount());
    }
    node.put(N_BINS, encounter.getBins().size());
    node.put(WINDOW_DAYS, encounter.getWindowDays());
    ArrayNode bins = node.putArray(BINS);
    for (AngularBin bin : encounter.getBins()) {
      ObjectNode binNode = bins.addObject();
      binNode.put(START_LON, bin.getStartLon());
      binNode.put(END_LON, bin.getEndLon());
      binNode.put(HAM_COUNT, bin.getHamCount());
      binNode.put(ALL_COUNT, bin.getAllCount());
      binNode.put(HAM_FRAC, bin.getHamFrac());
    }
    return node;
  }

  /**
   * Compare freshly computed bins against cached ones. Longitudes are compared on the circle
   * (359.9995 and 0.0 differ by 0.0005); occurrence fractions directly. A differing bin count
   * is reported once with bin index -1, and only the bins present in both are compared.
   * Nothing is corrected; each discrepancy is logged as a warning.
   *
   * @param cached Encounter read from the cache
   * @param computed Encounter recomputed from the inputs
   * @param tolerance Largest difference treated as agreement
   * @return Every field differing by more than the tolerance
   */
  public static List<CacheDiscrepancy> compare(Encounter cached, Encounter computed,
      double tolerance) {
    List<CacheDiscrepancy> out = new ArrayList<>();
    String id = cached.getId();
    List<AngularBin> cachedBins = cached.getBins();
    List<AngularBin> computedBins = computed.getBins();
    if (cachedBins.size() != computedBins.size()) {
      out.add(new CacheDiscrepancy(id, -1, N_BINS, cachedBins.size(), computedBins.size()));
    }
    int common = Math.min(cachedBins.size(), computedBins.size());
    for (int i = 0; i < common; ++i) {
      AngularBin was = cachedBins.get(i);
      AngularBin now = computedBins.get(i);
      if (!(Math.abs(AngularBinUtils.wrapDelta(was.getStartLon(), now.getStartLon()))
          <= tolerance)) {
        out.add(new CacheDiscrepancy(id, i, START_LON, was.getStartLon(), now.getStartLon()));
      }
      if (!(Math.abs(AngularBinUtils.wrapDelta(was.getEndLon(), now.getEndLon()))
          <= tolerance)) {
        out.add(new CacheDiscrepancy(id, i, END_LON, was.getEndLon(), now.getEndLon()));
      }
      if (!(Math.abs(was.getHamFrac() - now.getHamFrac()) <= tolerance)) {
        out.add(new CacheDiscrepancy(id, i, HAM_FRAC, was.getHamFrac(), now.getHamFrac()));
      }
    }
    for (CacheDiscrepancy discrepancy : out) {
      logger.warn("Cache mismatch: " + discrepancy);
    }
    return out;
  }
}
