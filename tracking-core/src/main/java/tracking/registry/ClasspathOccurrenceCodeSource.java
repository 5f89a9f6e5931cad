package tracking.registry;

import tracking.model.CanonicalStatus;
import tracking.model.OccurrenceCode;
import tracking.model.Severity;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads the taxonomy from a semicolon separated classpath resource.
 *
 * <p>Columns: {@code carrier;code;description;type;process;canonical_status;severity}.
 * Blank lines and lines starting with {@code #} are ignored. The bundled resource
 * {@value #DEFAULT_RESOURCE} carries the shared SSW code set.
 */
public final class ClasspathOccurrenceCodeSource implements OccurrenceCodeSource {
  public static final String DEFAULT_RESOURCE = "tracking/occurrence-codes.csv";

  private static final int COLUMNS = 7;

  private final String resource;
  private final ClassLoader classLoader;

  public ClasspathOccurrenceCodeSource() {
    this(DEFAULT_RESOURCE);
  }

  public ClasspathOccurrenceCodeSource(String resource) {
    this(resource, ClasspathOccurrenceCodeSource.class.getClassLoader());
  }

  public ClasspathOccurrenceCodeSource(String resource, ClassLoader classLoader) {
    this.resource = Objects.requireNonNull(resource, "resource");
    this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
  }

  @Override
  public List<OccurrenceCode> load() throws IOException {
    InputStream in = classLoader.getResourceAsStream(resource);
    if (in == null) {
      throw new IOException("Occurrence code resource not found: " + resource);
    }
    List<OccurrenceCode> codes = new ArrayList<>();
    try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
      String line;
      int lineNo = 0;
      while ((line = reader.readLine()) != null) {
        lineNo++;
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
          continue;
        }
        codes.add(parseLine(trimmed, lineNo));
      }
    }
    return codes;
  }

  private OccurrenceCode parseLine(String line, int lineNo) throws IOException {
    String[] cols = line.split(";", -1);
    if (cols.length != COLUMNS) {
      throw new IOException(resource + ":" + lineNo + ": expected " + COLUMNS
          + " columns, got " + cols.length);
    }
    try {
      return new OccurrenceCode(
          cols[0].trim(),
          cols[1],
          cols[2].trim(),
          cols[3].trim(),
          cols[4].trim(),
          CanonicalStatus.valueOf(cols[5].trim()),
          Severity.valueOf(cols[6].trim()));
    } catch (IllegalArgumentException e) {
      throw new IOException(resource + ":" + lineNo + ": " + e.getMessage(), e);
    }
  }
}
