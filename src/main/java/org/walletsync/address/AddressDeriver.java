package org.walletsync.address;

/**
 * Derives a wallet's addresses deterministically.
 */
public interface AddressDeriver {

	/** Returns address at <tt>chain</tt> (0 = receive, 1 = change) and <tt>index</tt>. */
	public String deriveAddress(int chain, int index) throws DescriptorException;

	/** Returns derivation path of address at <tt>chain</tt> and <tt>index</tt>, e.g. "m/84'/0'/0'/0/5". */
	public String derivationPath(int chain, int index);

}
