package ca.gc.cra.warden.infrastructure.capture;

import ca.gc.cra.warden.domain.detect.WardenFailure;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.pcap4j.core.PcapNativeException;
import org.pcap4j.core.PcapNetworkInterface;
import org.pcap4j.core.Pcaps;

/**
 * Resolves the capture interface, auto-detecting one when the operator asks for {@code auto}.
 *
 * <p>Auto-detection prefers an interface that is up, not loopback and has an address; then any non-loopback
 * interface; then loopback.</p>
 *
 * @since 0.1.0
 */
public final class InterfaceSelector {
  /** Interface value requesting auto-detection. */
  public static final String AUTO = "auto";

  static final String PERMISSION_SUGGESTION =
      "Run WARDEN as root, or grant capture capabilities: "
          + "sudo setcap cap_net_raw,cap_net_admin=eip \"$(readlink -f \"$(command -v java)\")\"";

  private InterfaceSelector() {}

  /**
   * Resolves the interface to open.
   *
   * @param requested configured name, or {@code auto}/blank for auto-detection
   * @return interface name
   * @throws CaptureException if the interface is missing or devices cannot be listed
   */
  public static String resolve(String requested) throws CaptureException {
    List<Candidate> candidates = listCandidates();
    if (requested != null && !requested.isBlank() && !AUTO.equalsIgnoreCase(requested.trim())) {
      String name = requested.trim();
      for (Candidate candidate : candidates) {
        if (candidate.name().equals(name)) {
          return name;
        }
      }
      throw notFound("Interface not found: " + name, candidates);
    }
    return choose(candidates)
        .map(Candidate::name)
        .orElseThrow(() -> notFound("No capture interface available for auto-detection", candidates));
  }

  /**
   * Picks the preferred candidate.
   *
   * @param candidates interfaces in discovery order
   * @return preferred interface; empty if none
   */
  static Optional<Candidate> choose(List<Candidate> candidates) {
    return candidates.stream().min(Comparator.comparingInt(Candidate::rank));
  }

  /**
   * Maps a native capture error onto a structured failure, recognizing permission problems.
   *
   * @param context what was being attempted
   * @param ex native failure
   * @return capture exception
   */
  static CaptureException classify(String context, Exception ex) {
    String message = ex.getMessage() == null ? "" : ex.getMessage();
    String lower = message.toLowerCase(Locale.ROOT);
    if (lower.contains("permission") || lower.contains("not permitted") || lower.contains("access denied")) {
      return new CaptureException(
          WardenFailure.Kind.PERMISSION_DENIED,
          context + ": insufficient capture privileges (" + message + ")",
          PERMISSION_SUGGESTION,
          ex);
    }
    return new CaptureException(
        WardenFailure.Kind.CAPTURE_IO,
        context + ": " + message,
        "Check that libpcap is installed and the interface is up",
        ex);
  }

  private static List<Candidate> listCandidates() throws CaptureException {
    List<PcapNetworkInterface> devices;
    try {
      devices = Pcaps.findAllDevs();
    } catch (PcapNativeException ex) {
      throw classify("Listing capture interfaces failed", ex);
    }
    List<Candidate> candidates = new ArrayList<>();
    if (devices != null) {
      for (PcapNetworkInterface device : devices) {
        candidates.add(new Candidate(
            device.getName(), device.isLoopBack(), device.isUp(), !device.getAddresses().isEmpty()));
      }
    }
    return candidates;
  }

  private static CaptureException notFound(String detail, List<Candidate> candidates) {
    List<String> names = new ArrayList<>();
    for (Candidate candidate : candidates) {
      names.add(candidate.name());
    }
    String suggestion = names.isEmpty()
        ? "No interfaces are visible; " + PERMISSION_SUGGESTION
        : "Set interface= to one of " + String.join(", ", names);
    return new CaptureException(WardenFailure.Kind.INTERFACE_NOT_FOUND, detail, suggestion, null);
  }

  /**
   * Interface facts used for auto-detection.
   *
   * @param name device name
   * @param loopback loopback flag
   * @param up administrative up flag
   * @param hasAddress whether any address is assigned
   */
  record Candidate(String name, boolean loopback, boolean up, boolean hasAddress) {
    int rank() {
      if (!loopback && up && hasAddress) {
        return 0;
      }
      if (!loopback && up) {
        return 1;
      }
      if (!loopback) {
        return 2;
      }
      return 3;
    }
  }
}
