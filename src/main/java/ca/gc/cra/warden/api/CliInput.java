package ca.gc.cra.warden.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command line of one WARDEN command split into flags, {@code key=value} overrides and bare arguments.
 *
 * <p>{@code warden analyze capture.pcap --no-ml} and {@code warden analyze pcap=capture.pcap ml=false} are
 * equivalent; each command declares which flags and how many bare arguments it takes through
 * {@link #requireOnly(Set, int)}.</p>
 *
 * @since 0.1.0
 */
public final class CliInput {
  /** Print the wiring plan for {@code live} and exit without capturing. */
  public static final String DRY_RUN = "--dry-run";
  /** Skip the per-packet detectors in {@code analyze}. */
  public static final String NO_ML = "--no-ml";

  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final List<String> keyValueArgs;
  private final List<String> positional;
  private final Set<String> flags;
  private final boolean help;
  private final boolean verbose;

  private CliInput(List<String> keyValueArgs, List<String> positional, Set<String> flags, boolean help,
      boolean verbose) {
    this.keyValueArgs = List.copyOf(keyValueArgs);
    this.positional = List.copyOf(positional);
    this.flags = Set.copyOf(flags);
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Splits raw arguments. Flags are matched case-insensitively; blank arguments are ignored.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed command line
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    List<String> positional = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    boolean help = false;
    boolean verbose = false;
    if (args == null) {
      return new CliInput(kv, positional, flags, false, false);
    }
    for (String raw : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
      } else if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else if (arg.contains("=")) {
        kv.add(arg);
      } else {
        positional.add(arg);
      }
    }
    return new CliInput(kv, positional, flags, help, verbose);
  }

  /**
   * Rejects flags and bare arguments the command does not understand.
   *
   * @param allowedFlags command-specific flags, lower case
   * @param maxPositional number of bare arguments the command accepts
   * @throws IllegalArgumentException naming the first unexpected argument
   */
  public void requireOnly(Set<String> allowedFlags, int maxPositional) {
    for (String flag : flags) {
      if (!allowedFlags.contains(flag)) {
        throw new IllegalArgumentException("unknown flag " + flag);
      }
    }
    if (positional.size() > maxPositional) {
      throw new IllegalArgumentException("unexpected argument '" + positional.get(maxPositional)
          + "' (use key=value)");
    }
  }

  /**
   * Returns the {@code key=value} arguments in command-line order.
   *
   * @return arguments intended for {@link CliArgsParser#toMap(String[])}
   */
  public String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  /**
   * Returns arguments that are neither flags nor {@code key=value}.
   *
   * @return bare arguments in command-line order
   */
  public List<String> positionalArgs() {
    return positional;
  }

  public boolean help() {
    return help;
  }

  public boolean verbose() {
    return verbose;
  }

  public boolean dryRun() {
    return flags.contains(DRY_RUN);
  }

  public boolean noMl() {
    return flags.contains(NO_ML);
  }

  /**
   * Checks for a command-specific flag.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }
}
