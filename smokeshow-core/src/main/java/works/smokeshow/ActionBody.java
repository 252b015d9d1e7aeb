package works.smokeshow;

/**
 * The work done inside an action span.
 */
@FunctionalInterface
public interface ActionBody<T> {
	T run(ActionSpan action);
}
