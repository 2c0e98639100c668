package works.hit.example;

import java.util.ArrayList;
import java.util.List;
import works.hit.exceptions.HitException;
import works.hit.exceptions.ValueException;
import works.hit.tree.Node;
import works.hit.tree.NodeType;
import works.hit.tree.ParamType;

/**
 * The settings a transient simulation needs from its input tree.
 * Optional parameters take the same defaults as the simulation framework's {@code Transient} executioner.
 */
public record SimulationSettings(
	int dim,
	int nx,
	int ny,
	String executionerType,
	double dt,
	int numSteps,
	double startTime,
	double endTime,
	List<String> kernels,
	boolean exodus,
	boolean csv
) {
	public static final int DEFAULT_NUM_STEPS = Integer.MAX_VALUE;
	public static final double DEFAULT_END_TIME = 1.0e30;

	public SimulationSettings {
		kernels = List.copyOf(kernels);
	}

	/**
	 * @param root an {@link works.hit.Hit#explode exploded} tree
	 * @throws ValueException if a required parameter is missing or malformed;
	 * the message names the section in which the problem was found
	 */
	public static SimulationSettings from(Node root) {
		Node mesh = section(root, "Mesh");
		Node executioner = section(root, "Executioner");
		try {
			int dim = mesh.param("dim", ParamType.INT);
			int nx = mesh.param("nx", ParamType.INT);
			int ny = mesh.paramOptional("ny", ParamType.INT, dim >= 2 ? nx : 1);
			String type = executioner.param("type", ParamType.STRING);
			double dt = executioner.param("dt", ParamType.FLOAT);
			int numSteps = executioner.paramOptional("num_steps", ParamType.INT, DEFAULT_NUM_STEPS);
			double startTime = executioner.paramOptional("start_time", ParamType.FLOAT, 0.0);
			double endTime = executioner.paramOptional("end_time", ParamType.FLOAT, DEFAULT_END_TIME);
			if (dt <= 0) {
				throw new ValueException("dt must be positive: " + dt);
			}
			if (endTime < startTime) {
				throw new ValueException("end_time " + endTime + " precedes start_time " + startTime);
			}
			return new SimulationSettings(
				dim, nx, ny,
				type, dt, numSteps, startTime, endTime,
				kernelNames(root),
				root.paramOptional("Outputs/exodus", ParamType.BOOL, false),
				root.paramOptional("Outputs/csv", ParamType.BOOL, false));
		} catch (ValueException e) {
			throw HitException.wrap(e, "Invalid simulation input");
		}
	}

	/**
	 * @return the number of steps the run will actually take, whichever of
	 * {@link #numSteps} and {@link #endTime} is reached first
	 */
	public long effectiveSteps() {
		double byTime = Math.ceil((endTime - startTime) / dt);
		return (long) Math.min(numSteps, byTime);
	}

	private static Node section(Node root, String name) {
		Node result = root.find(name);
		if (result == null || result.type() != NodeType.SECTION) {
			throw new ValueException("Missing [" + name + "] section");
		}
		return result;
	}

	private static List<String> kernelNames(Node root) {
		Node kernels = root.find("Kernels");
		if (kernels == null) {
			return List.of();
		}
		List<String> result = new ArrayList<>();
		for (Node kernel: kernels.children(NodeType.SECTION)) {
			result.add(kernel.path());
		}
		return result;
	}
}
