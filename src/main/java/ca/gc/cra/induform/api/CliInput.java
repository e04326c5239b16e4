package ca.gc.cra.induform.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Parsed representation of CLI arguments split into flags and key/value pairs.
 *
 * <p>Some flags are shorthands for options: {@code --strict} means {@code strict=true}, {@code --force} and
 * {@code --allow-overwrite} mean {@code allowOverwrite=true} and {@code --json} means {@code format=json}.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");
  private static final Map<String, Map.Entry<String, String>> OPTION_FLAGS = Map.of(
      "--strict", Map.entry("strict", "true"),
      "-s", Map.entry("strict", "true"),
      "--force", Map.entry("allowOverwrite", "true"),
      "-f", Map.entry("allowOverwrite", "true"),
      "--allow-overwrite", Map.entry("allowOverwrite", "true"),
      "--json", Map.entry("format", "json"));

  private final String[] keyValueArgs;
  private final Set<String> flags;
  private final boolean help;
  private final boolean verbose;

  private CliInput(String[] keyValueArgs, Set<String> flags, boolean help, boolean verbose) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments into flag and key/value partitions.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation of the arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], Set.of(), false, false);
    }

    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    boolean help = false;
    boolean verbose = false;
    for (String raw : args) {
      if (raw == null) {
        continue;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
        flags.add("--help");
        continue;
      }
      if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
        flags.add("--verbose");
        continue;
      }
      if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
        continue;
      }
      kv.add(arg);
    }
    return new CliInput(kv.toArray(String[]::new), Collections.unmodifiableSet(flags), help, verbose);
  }

  /**
   * Returns a defensive copy of the key/value style arguments.
   *
   * @return copy of arguments intended for key=value parsing
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  public boolean help() {
    return help;
  }

  public boolean verbose() {
    return verbose;
  }

  /**
   * Checks whether a normalized flag such as {@code --strict} was provided.
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

  /**
   * Translates shorthand flags into the options they stand for.
   *
   * @return options implied by the supplied flags, in flag order
   */
  public Map<String, String> flagOptions() {
    Map<String, String> options = new LinkedHashMap<>();
    for (String flag : flags) {
      Map.Entry<String, String> option = OPTION_FLAGS.get(flag);
      if (option != null) {
        options.put(option.getKey(), option.getValue());
      }
    }
    return options;
  }

  /**
   * Returns flags that are neither help, verbose nor a known shorthand.
   *
   * @return unrecognized flags in supplied order
   */
  public List<String> unknownFlags() {
    List<String> unknown = new ArrayList<>();
    for (String flag : flags) {
      if (!flag.equals("--help") && !flag.equals("--verbose") && !OPTION_FLAGS.containsKey(flag)) {
        unknown.add(flag);
      }
    }
    return unknown;
  }
}
