package works.smokeshow;

public enum ElementState {
	ATTACHED,
	DETACHED,
	VISIBLE,
	HIDDEN,
}
