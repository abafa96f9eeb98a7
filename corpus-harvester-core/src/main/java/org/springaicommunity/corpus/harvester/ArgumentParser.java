package org.springaicommunity.corpus.harvester;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Command-line argument parser for the corpus harvester. Pure Java with no framework
 * dependencies so it can be tested directly.
 *
 * <p>
 * The first non-option argument is the command. Options may appear before or after it.
 */
public class ArgumentParser {

	public static final List<String> COMMANDS = List.of("issues", "discussions", "stackoverflow", "reviews", "harvest",
			"synthesize", "assemble");

	static final List<SourceType> INCIDENT_SOURCES = List.of(SourceType.GITHUB_ISSUES, SourceType.GITHUB_DISCUSSIONS,
			SourceType.STACKOVERFLOW);

	private static final List<String> PROFILES = List.of("incident", "code_review", "code-review");

	private final HarvestProperties defaultProperties;

	public ArgumentParser(HarvestProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-t", "--tech":
					String techStr = getRequiredValue(args, i, "tech");
					config.technologies = splitList(techStr);
					i++; // Skip next argument since we consumed it
					break;

				case "--min-date":
					config.minDate = getRequiredValue(args, i, "min-date");
					if (!config.minDate.matches("\\d{4}-\\d{2}-\\d{2}")) {
						throw new IllegalArgumentException(
								"Invalid date '" + config.minDate + "': must be YYYY-MM-DD format");
					}
					i++; // Skip next argument since we consumed it
					break;

				case "-o", "--output-dir":
					config.outputDir = getRequiredValue(args, i, "output-dir");
					i++; // Skip next argument since we consumed it
					break;

				case "-m", "--max-per-unit":
					config.maxPerUnit = parsePositiveInt(getRequiredValue(args, i, "max-per-unit"), "max per unit");
					i++; // Skip next argument since we consumed it
					break;

				case "-d", "--dry-run":
					config.dryRun = true;
					break;

				case "-n", "--count":
					config.count = parsePositiveInt(getRequiredValue(args, i, "count"), "count");
					i++; // Skip next argument since we consumed it
					break;

				case "-b", "--batch-size":
					config.batchSize = parsePositiveInt(getRequiredValue(args, i, "batch-size"), "batch size");
					i++; // Skip next argument since we consumed it
					break;

				case "--profile":
					String profile = getRequiredValue(args, i, "profile").toLowerCase(Locale.ROOT);
					if (!PROFILES.contains(profile)) {
						throw new IllegalArgumentException(
								"Invalid profile '" + profile + "': must be 'incident' or 'code_review'");
					}
					config.profile = profile.replace('-', '_');
					i++; // Skip next argument since we consumed it
					break;

				case "--resume":
					config.resume = true;
					break;

				case "--checkpoint":
					config.checkpointFile = getRequiredValue(args, i, "checkpoint");
					i++; // Skip next argument since we consumed it
					break;

				case "--train-ratio":
					String ratioStr = getRequiredValue(args, i, "train-ratio");
					try {
						config.trainRatio = Double.parseDouble(ratioStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid train ratio '" + ratioStr + "': must be a number between 0 and 1");
					}
					i++; // Skip next argument since we consumed it
					break;

				case "--seed":
					String seedStr = getRequiredValue(args, i, "seed");
					try {
						config.seed = Long.parseLong(seedStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException("Invalid seed '" + seedStr + "': must be an integer");
					}
					i++; // Skip next argument since we consumed it
					break;

				case "--sources":
					String sourcesStr = getRequiredValue(args, i, "sources");
					config.sources = splitList(sourcesStr);
					i++; // Skip next argument since we consumed it
					break;

				case "--no-synthetic":
					config.noSynthetic = true;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					if (config.command != null) {
						throw new IllegalArgumentException(
								"Unexpected argument '" + arg + "': command already set to '" + config.command + "'");
					}
					config.command = arg.toLowerCase(Locale.ROOT);
					break;
			}
		}

		// Validate configuration
		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested or no arguments were given
	 */
	public boolean isHelpRequested(String[] args) {
		if (args.length == 0) {
			return true;
		}
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: corpus-harvester COMMAND [OPTIONS]\n");
		help.append("\n");
		help.append("Harvest incident and code-review conversations, synthesize examples and build datasets.\n");
		help.append("\n");
		help.append("COMMANDS:\n");
		help.append("    issues                 Harvest closed GitHub issues with solutions\n");
		help.append("    discussions            Harvest answered GitHub Discussions\n");
		help.append("    stackoverflow          Harvest Stack Overflow questions with accepted answers\n");
		help.append("    reviews                Harvest pull request review comments\n");
		help.append("    harvest                Harvest issues, discussions and Stack Overflow in parallel\n");
		help.append("    synthesize             Generate synthetic examples from prompt templates\n");
		help.append("    assemble               Curate corpora and write train/eval partitions\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -v, --verbose           Enable verbose logging\n");
		help.append("    -o, --output-dir DIR    Output directory (default: ")
			.append(defaultProperties.getOutputDir())
			.append(")\n");
		help.append("\n");
		help.append("HARVEST OPTIONS:\n");
		help.append("    -t, --tech LIST         Comma-separated technologies (default: all configured)\n");
		help.append("    --min-date DATE         Only records created on or after DATE, YYYY-MM-DD (default: ")
			.append(defaultProperties.getMinDate())
			.append(")\n");
		help.append("    -m, --max-per-unit N    Cap per repository or tag (default: per-source setting)\n");
		help.append("    -d, --dry-run           Collect and filter without writing corpus files\n");
		help.append("\n");
		help.append("SYNTHESIS OPTIONS:\n");
		help.append("    --profile NAME          Template profile: incident, code_review (default: incident)\n");
		help.append("    -n, --count N           Target number of examples (default: ")
			.append(defaultProperties.getTargetExamples())
			.append(")\n");
		help.append("    -b, --batch-size N      Responses requested per call (default: ")
			.append(defaultProperties.getBatchSize())
			.append(")\n");
		help.append("    --resume                Continue from the existing checkpoint\n");
		help.append("    --checkpoint FILE       Checkpoint file (default: DIR/synthetic/synthetic_PROFILE.json)\n");
		help.append("\n");
		help.append("ASSEMBLY OPTIONS:\n");
		help.append("    --sources LIST          Corpus sources to include (default: ")
			.append(String.join(",", INCIDENT_SOURCES.stream().map(SourceType::id).toList()))
			.append(")\n");
		help.append("    --no-synthetic          Do not include the synthetic checkpoint\n");
		help.append("    --train-ratio R         Fraction of examples in train (default: ")
			.append(defaultProperties.getTrainRatio())
			.append(")\n");
		help.append("    --seed N                Shuffle seed (default: ").append(defaultProperties.getSeed()).append(")\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN           GitHub token (required for issues, discussions, reviews, harvest)\n");
		help.append("    STACKEXCHANGE_API_KEY  Stack Exchange key (optional, raises the daily quota)\n");
		help.append("    ANTHROPIC_API_KEY      Anthropic API key (required for synthesize)\n");
		help.append("    Variables are also read from .env in the working or home directory\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    corpus-harvester harvest --tech kubernetes,docker --min-date 2022-01-01\n");
		help.append("    corpus-harvester stackoverflow --tech terraform --max-per-unit 50 --dry-run\n");
		help.append("    corpus-harvester reviews --output-dir data\n");
		help.append("    corpus-harvester synthesize --profile incident --count 500 --resume\n");
		help.append("    corpus-harvester assemble --train-ratio 0.9 --seed 42\n");
		help.append("\n");

		return help.toString();
	}

	/**
	 * Validate the environment for a command: GitHub commands need a token and synthesis
	 * needs an Anthropic API key.
	 * @param command the command about to run
	 * @throws IllegalStateException if a required variable is missing
	 */
	public void validateEnvironment(String command) {
		switch (command) {
			case "issues", "discussions", "reviews", "harvest":
				if (EnvironmentSupport.get(EnvironmentSupport.GITHUB_TOKEN) == null) {
					throw new IllegalStateException(
							"GITHUB_TOKEN environment variable is required. Please set your GitHub personal access token: export GITHUB_TOKEN=your_token_here");
				}
				break;
			case "synthesize":
				if (EnvironmentSupport.get(EnvironmentSupport.ANTHROPIC_API_KEY) == null) {
					throw new IllegalStateException(
							"ANTHROPIC_API_KEY environment variable is required for synthesis: export ANTHROPIC_API_KEY=your_key_here");
				}
				break;
			default:
				break;
		}
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private static int parsePositiveInt(String value, String name) {
		int parsed;
		try {
			parsed = Integer.parseInt(value);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be a positive integer");
		}
		if (parsed <= 0) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "': must be a positive integer");
		}
		return parsed;
	}

	private static List<String> splitList(String value) {
		return Arrays.stream(value.split(","))
			.map(String::trim)
			.map(String::toLowerCase)
			.filter(s -> !s.isEmpty())
			.collect(ArrayList::new, ArrayList::add, ArrayList::addAll);
	}

	private void validateConfiguration(ParsedConfiguration config) {
		if (config.helpRequested) {
			return;
		}
		List<String> errors = new ArrayList<>();

		// Validate command
		if (config.command == null) {
			errors.add("Command is required (one of " + String.join(", ", COMMANDS) + ")");
		}
		else if (!COMMANDS.contains(config.command)) {
			errors.add("Unknown command: " + config.command + " (must be one of " + String.join(", ", COMMANDS) + ")");
		}

		// Validate technologies
		for (String tech : config.technologies) {
			if (!tech.matches("^[a-z0-9._-]+$")) {
				errors.add("Invalid technology '" + tech + "' (letters, digits, '.', '_' and '-' only)");
			}
		}

		// Validate date
		try {
			DateFloor.parse(config.minDate);
		}
		catch (IllegalArgumentException e) {
			errors.add("Invalid min date: " + config.minDate + " (" + e.getMessage() + ")");
		}

		if (config.outputDir.isBlank()) {
			errors.add("Output directory cannot be empty");
		}

		// Validate synthesis settings
		if (config.batchSize > 50) {
			errors.add("Batch size too large (got: " + config.batchSize + ", max: 50)");
		}

		// Validate assembly settings
		if (config.trainRatio < 0.0 || config.trainRatio > 1.0) {
			errors.add("Train ratio must be between 0 and 1 (got: " + config.trainRatio + ")");
		}
		for (String source : config.sources) {
			try {
				SourceType.fromId(source);
			}
			catch (IllegalArgumentException e) {
				errors.add("Unknown source: " + source);
			}
		}

		// Report validation errors
		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
