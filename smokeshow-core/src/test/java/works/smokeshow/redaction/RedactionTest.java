package works.smokeshow.redaction;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.smokeshow.redaction.Redaction.REDACTED;

class RedactionTest {
	@ParameterizedTest
	@ValueSource(strings = {
		"input#password",
		"input[name=\"Password\"]",
		"#card-number",
		"input.CVV",
		"[data-test=ssn]",
		"#credit_limit",
		"#client-secret",
		"input[name=csrfToken]",
	})
	void selectorWithKeyword_redacted(String selector) {
		assertTrue(Redaction.shouldRedact(selector, false));
		assertEquals(REDACTED, Redaction.redactIfNeeded("hunter2", selector, false));
	}

	@ParameterizedTest
	@ValueSource(strings = {
		"input#email",
		"#search",
		"button[type=submit]",
	})
	void ordinarySelector_notRedacted(String selector) {
		assertFalse(Redaction.shouldRedact(selector, false));
		assertEquals("alice@example.com", Redaction.redactIfNeeded("alice@example.com", selector, false));
	}

	@Test
	void explicitlySensitive_redactedRegardlessOfSelector() {
		assertTrue(Redaction.shouldRedact("input#email", true));
		assertTrue(Redaction.shouldRedact(null, true));
		assertFalse(Redaction.shouldRedact(null, false));
	}

	@Test
	void valueContents_notInspected() {
		// Only the selector and the flag matter; a card number in an innocuous field is recorded as-is.
		assertEquals("4111111111111111", Redaction.redactIfNeeded("4111111111111111", "#promo", false));
	}

	@Test
	void redactValue_alwaysSameMarker() {
		assertEquals(REDACTED, Redaction.redactValue("x"));
		assertEquals(REDACTED, Redaction.redactValue(""));
		assertEquals(REDACTED, Redaction.redactValue(null));
	}

	@Test
	void scrub_replacesEveryOccurrence() {
		assertEquals(
			"Cannot type [REDACTED] into #pw; [REDACTED] rejected",
			Redaction.scrub("Cannot type hunter2 into #pw; hunter2 rejected", "hunter2"));
		assertEquals("unchanged", Redaction.scrub("unchanged", null));
		assertEquals("unchanged", Redaction.scrub("unchanged", ""));
		assertNull(Redaction.scrub(null, "hunter2"));
	}
}
