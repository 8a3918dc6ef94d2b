package com.leyline;

import com.leyline.commands.CategoriesCommand;
import com.leyline.commands.CommandOptions;
import com.leyline.commands.DiscoveryCommand;
import com.leyline.commands.SearchCommand;
import com.leyline.commands.ShowCommand;
import com.leyline.discovery.DiscoveryConfig;
import com.leyline.discovery.cache.MetadataCache;
import com.leyline.exception.ConfigException;
import com.leyline.exception.DiscoveryException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.commons.configuration2.Configuration;

/** Wires configuration, the metadata cache and the requested command for one invocation. */
public class Leyline implements AutoCloseable {

  private static final org.slf4j.Logger log =
      com.leyline.logging.LoggingService.getLogger(Leyline.class);

  static final String USAGE =
      """
      Usage: leyline <command> [argument] [options]

      Commands:
        categories            List categories with their document counts
        show <category>       List the documents of a category
        search <query>        Search titles, ids and content with typo tolerance
        help                  Show this message

      Options:
        --corpus <dir>        Corpus checkout root (default: leyline.corpus.root)
        --config-file <loc>   Configuration location (default: classpath:application.yaml)
        --limit <n>           Maximum search results to show (default: 10)
        --compress            Store cached previews compressed
        --stats               Print cache statistics
        --verbose             Show paths, previews and matched fields
        --json                Print JSON instead of text
      """;

  private final StartupParameters startupParameters;
  private final PrintStream out;
  private ConfigurationProvider configurationProvider;
  private MetadataCache cache;

  public Leyline(String[] applicationArgs) {
    this(applicationArgs, System.out);
  }

  public Leyline(String[] applicationArgs, PrintStream out) {
    this.startupParameters = new StartupParameters(applicationArgs);
    this.out = out;
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public Configuration configuration() {
    return configurationProvider.config();
  }

  public MetadataCache cache() {
    return cache;
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    com.leyline.logging.LoggingService.applyConfiguration(configuration());

    DiscoveryConfig config = DiscoveryConfig.from(configuration());
    if (startupParameters.isFlagSet("compress")) {
      config = config.withCompression(true);
    }
    Path corpusRoot = resolveCorpusRoot();
    log.debug("Using corpus root {} with {}", corpusRoot, config);
    this.cache = MetadataCache.forCorpus(corpusRoot, config);
  }

  /** @return process exit code */
  public int run() {
    String command = startupParameters.command();
    if ("help".equals(command)) {
      out.print(USAGE);
      return 0;
    }
    if (cache == null) {
      initialize();
    }
    CommandOptions options = CommandOptions.from(startupParameters);
    String argument = startupParameters.argument().orElse(null);
    try {
      DiscoveryCommand cmd =
          switch (command) {
            case "categories" -> new CategoriesCommand(cache, options, out);
            case "show" -> new ShowCommand(cache, options, out, argument);
            case "search" -> new SearchCommand(cache, options, out, argument);
            default -> throw new IllegalArgumentException("Unknown command: " + command);
          };
      return cmd.execute();
    } catch (DiscoveryException e) {
      out.println("❌ " + e.getMessage());
      e.getSuggestions().forEach(s -> out.println("  - " + s));
      return 1;
    }
  }

  private Path resolveCorpusRoot() {
    String root =
        startupParameters
            .corpusRoot()
            .orElseGet(() -> configuration().getString("leyline.corpus.root", "."));
    if (root == null || root.isBlank()) {
      throw new ConfigException("leyline.corpus.root is empty");
    }
    return Paths.get(root).toAbsolutePath().normalize();
  }

  @Override
  public void close() {
    if (cache != null) {
      cache.close();
    }
  }
}
