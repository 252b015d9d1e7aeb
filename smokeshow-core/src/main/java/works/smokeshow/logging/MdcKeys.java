package works.smokeshow.logging;

/**
 * Keys to use for SLF4J's Mapped Diagnostic Context.
 * Each is populated only while the corresponding scope is open.
 */
public final class MdcKeys {
	private MdcKeys() {}

	/**
	 * The suite name from the resolved configuration.
	 */
	public static final String SUITE = "smokeshow.suite";

	/**
	 * The identifier generated for each suite run; also recorded as <code>test.suite.id</code>.
	 */
	public static final String RUN_ID = "smokeshow.runID";

	/**
	 * The test case's ID if it has one, else its name.
	 */
	public static final String TEST_CASE = "smokeshow.testCase";
}
