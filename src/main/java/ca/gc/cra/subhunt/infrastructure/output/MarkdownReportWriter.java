package ca.gc.cra.subhunt.infrastructure.output;

import ca.gc.cra.subhunt.application.port.ReportPort;
import ca.gc.cra.subhunt.domain.ResolvedHost;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the results as a Markdown table, replacing any existing file.
 *
 * <p>Rows appear in the order given (the use case sorts them by hostname); addresses are sorted
 * and comma-joined.</p>
 *
 * @since 0.1.0
 */
public final class MarkdownReportWriter implements ReportPort {
  private static final Logger log = LoggerFactory.getLogger(MarkdownReportWriter.class);

  private final Path target;

  public MarkdownReportWriter(Path target) {
    this.target = Objects.requireNonNull(target, "target");
  }

  @Override
  public void write(String domain, List<ResolvedHost> hosts) throws IOException {
    try (BufferedWriter out = Files.newBufferedWriter(
        target,
        StandardCharsets.UTF_8,
        StandardOpenOption.CREATE,
        StandardOpenOption.TRUNCATE_EXISTING,
        StandardOpenOption.WRITE)) {
      out.write("# Subdomains of " + domain);
      out.newLine();
      out.newLine();
      out.write("| Hostname | Addresses |");
      out.newLine();
      out.write("|---|---|");
      out.newLine();
      for (ResolvedHost host : hosts) {
        out.write("| " + cell(host.hostname()) + " | " + cell(host.addresses().joined()) + " |");
        out.newLine();
      }
    }
    log.info("Wrote {} row(s) to {}", hosts.size(), target);
  }

  private static String cell(String value) {
    return value.replace("|", "\\|");
  }
}
