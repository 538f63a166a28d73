package org.walletsync.address;

import org.walletsync.address.OutputDescriptor.ScriptKind;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses single-key output descriptors: <tt>wpkh(KEY)</tt>, <tt>pkh(KEY)</tt> and <tt>sh(wpkh(KEY))</tt>.
 * <p>
 * KEY is an extended public key with optional <tt>[fingerprint/path]</tt> origin,
 * optionally followed by <tt>/&lt;0;1&gt;/*</tt>, <tt>/0/*</tt> or <tt>/1/*</tt>.
 * A trailing <tt>#checksum</tt> is ignored.
 */
public abstract class DescriptorParser {

	private static final Pattern SCRIPT_PATTERN = Pattern.compile("^(wpkh|pkh|sh)\\((.+)\\)$");

	private static final Pattern KEY_PATTERN = Pattern.compile(
			"^(?:\\[([0-9a-fA-F]{8})((?:/[0-9]+['hH]?)*)\\])?"
			+ "([1-9A-HJ-NP-Za-km-z]{100,120})"
			+ "(?:/(?:<0;1>|0|1)/\\*)?$");

	public static OutputDescriptor parse(String descriptor) throws DescriptorException {
		if (descriptor == null || descriptor.trim().isEmpty())
			throw new DescriptorException("Empty descriptor");

		String body = descriptor.trim();

		int checksumIndex = body.indexOf('#');
		if (checksumIndex >= 0)
			body = body.substring(0, checksumIndex);

		Matcher scriptMatcher = SCRIPT_PATTERN.matcher(body);
		if (!scriptMatcher.matches())
			throw new DescriptorException(String.format("Unsupported descriptor \"%s\"", body));

		String function = scriptMatcher.group(1);
		String inner = scriptMatcher.group(2);

		ScriptKind scriptKind;
		switch (function) {
			case "wpkh":
				scriptKind = ScriptKind.P2WPKH;
				break;

			case "pkh":
				scriptKind = ScriptKind.P2PKH;
				break;

			default:
				// Only sh(wpkh(...)) is supported
				Matcher nestedMatcher = SCRIPT_PATTERN.matcher(inner);
				if (!nestedMatcher.matches() || !nestedMatcher.group(1).equals("wpkh"))
					throw new DescriptorException(String.format("Unsupported sh() descriptor \"%s\"", body));

				scriptKind = ScriptKind.P2SH_P2WPKH;
				inner = nestedMatcher.group(2);
				break;
		}

		Matcher keyMatcher = KEY_PATTERN.matcher(inner);
		if (!keyMatcher.matches())
			throw new DescriptorException(String.format("Unsupported key expression \"%s\"", inner));

		String fingerprint = keyMatcher.group(1);
		String originSteps = keyMatcher.group(2);
		String extendedKey = keyMatcher.group(3);

		String originPath = "m";
		if (originSteps != null)
			originPath += originSteps.replace('h', '\'').replace('H', '\'');

		return new OutputDescriptor(scriptKind, fingerprint != null ? fingerprint.toLowerCase() : null, originPath, extendedKey);
	}

}
