package ca.gc.cra.warden.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Console output for usage text and dry-run plans.
 *
 * <p>Writes to the stdout file descriptor directly, so log output (stderr/appenders) and CLI output stay
 * separate.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints a titled, column-aligned key/value listing.
   *
   * @param title first line
   * @param rows ordered rows
   */
  public static void printTable(String title, Map<String, String> rows) {
    PrintWriter writer = writer();
    writer.println(title);
    int width = 0;
    for (String key : rows.keySet()) {
      width = Math.max(width, key.length());
    }
    for (Map.Entry<String, String> row : rows.entrySet()) {
      String value = row.getValue() == null || row.getValue().isEmpty() ? "<none>" : row.getValue();
      writer.println(" " + pad(row.getKey(), width) + " : " + value);
    }
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static String pad(String value, int width) {
    StringBuilder sb = new StringBuilder(value);
    while (sb.length() < width) {
      sb.append(' ');
    }
    return sb.toString();
  }

  private static PrintWriter writer() {
    PrintWriter testWriter = override;
    return testWriter != null ? testWriter : STDOUT;
  }
}
