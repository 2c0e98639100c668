package works.hit.example;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.hit.Hit;
import works.hit.exceptions.HitException;
import works.hit.tree.Root;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Configures a transient diffusion run from HIT input files.
 * <p>
 * Usage: {@code TransientExample [file...]}.
 * Files given later override parameters from files given earlier.
 * With no arguments, the bundled {@code ex06.i} is used.
 */
public final class TransientExample {
	public static final String BUNDLED_INPUT = "ex06.i";

	private TransientExample() {}

	public static void main(String[] args) throws IOException {
		List<Input> inputs = new ArrayList<>();
		if (args.length == 0) {
			inputs.add(Input.resource(BUNDLED_INPUT));
		} else {
			for (String arg: args) {
				inputs.add(Input.file(Path.of(arg)));
			}
		}
		try {
			SimulationSettings settings = SimulationSettings.from(combine(inputs));
			LOGGER.info("Settings: {}", settings);
			LOGGER.info("Running {} steps of {} on a {}x{} mesh with kernels {}",
				settings.effectiveSteps(), settings.executionerType(), settings.nx(), settings.ny(), settings.kernels());
		} catch (HitException e) {
			LOGGER.error("{}", e.getMessage());
			System.exit(1);
		}
	}

	/**
	 * Parses and {@link Hit#explode explodes} each input,
	 * then {@link Hit#merge merges} them so that later inputs win.
	 *
	 * @throws works.hit.exceptions.ParseException if any input is not valid HIT
	 */
	public static Root combine(List<Input> inputs) {
		Root result = new Root();
		for (Input input: inputs) {
			Root root = Hit.parse(input.label(), input.text());
			Hit.explode(root);
			LOGGER.debug("Merging {}", input.label());
			Hit.merge(root, result);
		}
		LOGGER.trace("Combined input:\n{}", result.render());
		return result;
	}

	/**
	 * The text of one input along with the label that identifies it in error messages.
	 */
	public record Input(String label, String text) {
		public static Input file(Path path) throws IOException {
			return new Input(path.toString(), Files.readString(path, UTF_8));
		}

		/**
		 * @param name of a resource on the classpath, relative to the root
		 */
		public static Input resource(String name) {
			try (InputStream in = TransientExample.class.getResourceAsStream("/" + name)) {
				if (in == null) {
					throw new IllegalArgumentException("No such resource: " + name);
				}
				return new Input(name, new String(in.readAllBytes(), UTF_8));
			} catch (IOException e) {
				throw new UncheckedIOException("Unable to read resource " + name, e);
			}
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TransientExample.class);
}
