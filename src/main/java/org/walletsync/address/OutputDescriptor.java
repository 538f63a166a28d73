package org.walletsync.address;

/**
 * Parsed single-key output descriptor, e.g. <tt>wpkh([d34db33f/84'/0'/0']xpub.../&lt;0;1&gt;/*)</tt>.
 */
public class OutputDescriptor {

	public enum ScriptKind {
		/** wpkh(KEY) */
		P2WPKH,
		/** pkh(KEY) */
		P2PKH,
		/** sh(wpkh(KEY)) */
		P2SH_P2WPKH
	}

	private final ScriptKind scriptKind;
	/** Hex fingerprint of master key, or null if no key origin given */
	private final String fingerprint;
	/** Origin derivation path, e.g. "m/84'/0'/0'", or "m" if no key origin given */
	private final String originPath;
	/** Account-level extended public key */
	private final String extendedKey;

	public OutputDescriptor(ScriptKind scriptKind, String fingerprint, String originPath, String extendedKey) {
		this.scriptKind = scriptKind;
		this.fingerprint = fingerprint;
		this.originPath = originPath;
		this.extendedKey = extendedKey;
	}

	public ScriptKind getScriptKind() {
		return this.scriptKind;
	}

	public String getFingerprint() {
		return this.fingerprint;
	}

	public String getOriginPath() {
		return this.originPath;
	}

	public String getExtendedKey() {
		return this.extendedKey;
	}

	/** Returns full derivation path of address at <tt>chain</tt>/<tt>index</tt>. */
	public String derivationPath(int chain, int index) {
		return String.format("%s/%d/%d", this.originPath, chain, index);
	}

}
