package works.smokeshow;

/**
 * The code of one test case. Throwing anything marks the test case as failed.
 */
@FunctionalInterface
public interface TestBody {
	void run(TestCase test);
}
