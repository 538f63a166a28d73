package org.walletsync.address;

import com.google.common.collect.ImmutableMap;
import org.bitcoinj.core.AddressFormatException;
import org.bitcoinj.core.Base58;
import org.bitcoinj.core.LegacyAddress;
import org.bitcoinj.core.NetworkParameters;
import org.bitcoinj.core.SegwitAddress;
import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Utils;
import org.bitcoinj.crypto.ChildNumber;
import org.bitcoinj.crypto.DeterministicKey;
import org.bitcoinj.crypto.HDDerivationException;
import org.bitcoinj.crypto.HDKeyDerivation;
import org.bitcoinj.params.MainNetParams;
import org.bitcoinj.params.RegTestParams;
import org.bitcoinj.params.TestNet3Params;
import org.bitcoinj.script.Script;
import org.bitcoinj.script.ScriptBuilder;
import org.walletsync.data.wallet.WalletData;

import java.nio.ByteBuffer;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Derives addresses from an {@link OutputDescriptor} using bitcoinj.
 * <p>
 * SLIP-132 key headers (ypub, zpub, upub, vpub) are accepted and treated as their xpub/tpub equivalent,
 * the script type coming from the descriptor.
 */
public class DescriptorAddressDeriver implements AddressDeriver {

	/** Extended public key version bytes, and whether they're mainnet */
	private static final Map<Integer, Boolean> PUBLIC_KEY_HEADERS = ImmutableMap.<Integer, Boolean>builder()
			.put(0x0488b21e, true) // xpub
			.put(0x049d7cb2, true) // ypub
			.put(0x04b24746, true) // zpub
			.put(0x043587cf, false) // tpub
			.put(0x044a5262, false) // upub
			.put(0x045f1cf6, false) // vpub
			.build();

	private final OutputDescriptor descriptor;
	private final NetworkParameters params;
	private final DeterministicKey accountKey;

	/** Chain index -> chain key */
	private final Map<Integer, DeterministicKey> chainKeys = new ConcurrentHashMap<>();

	public DescriptorAddressDeriver(OutputDescriptor descriptor, NetworkParameters params) throws DescriptorException {
		this.descriptor = descriptor;
		this.params = params;
		this.accountKey = deserializeKey(descriptor.getExtendedKey(), params);
	}

	/** Default {@link AddressDeriverFactory}, using the wallet's descriptor and network. */
	public static AddressDeriver forWallet(WalletData wallet) throws DescriptorException {
		OutputDescriptor descriptor = DescriptorParser.parse(wallet.getDescriptor());
		return new DescriptorAddressDeriver(descriptor, networkParameters(wallet.getNetwork()));
	}

	public static NetworkParameters networkParameters(String network) throws DescriptorException {
		if (network == null)
			throw new DescriptorException("No network given");

		switch (network) {
			case "mainnet":
				return MainNetParams.get();

			case "testnet":
				return TestNet3Params.get();

			case "regtest":
				return RegTestParams.get();

			default:
				throw new DescriptorException(String.format("Unsupported network \"%s\"", network));
		}
	}

	private static DeterministicKey deserializeKey(String extendedKey, NetworkParameters params) throws DescriptorException {
		byte[] payload;
		try {
			payload = Base58.decodeChecked(extendedKey);
		} catch (AddressFormatException e) {
			throw new DescriptorException("Extended key has bad encoding or checksum", e);
		}

		if (payload.length != 78)
			throw new DescriptorException(String.format("Extended key has unexpected length %d", payload.length));

		int header = ByteBuffer.wrap(payload, 0, 4).getInt();
		Boolean isMainnetKey = PUBLIC_KEY_HEADERS.get(header);
		if (isMainnetKey == null)
			throw new DescriptorException(String.format("Unsupported extended key header 0x%08x", header));

		boolean isMainnetParams = params.getId().equals(NetworkParameters.ID_MAINNET);
		if (isMainnetKey != isMainnetParams)
			throw new DescriptorException(String.format("Extended key doesn't belong to network %s", params.getId()));

		// Rewrite SLIP-132 headers so bitcoinj accepts the key
		ByteBuffer.wrap(payload, 0, 4).putInt(params.getBip32HeaderP2PKHpub());

		byte[] checksum = Sha256Hash.hashTwice(payload);
		byte[] withChecksum = new byte[payload.length + 4];
		System.arraycopy(payload, 0, withChecksum, 0, payload.length);
		System.arraycopy(checksum, 0, withChecksum, payload.length, 4);

		try {
			return DeterministicKey.deserializeB58(Base58.encode(withChecksum), params);
		} catch (IllegalArgumentException e) {
			throw new DescriptorException("Unable to deserialize extended key", e);
		}
	}

	@Override
	public String deriveAddress(int chain, int index) throws DescriptorException {
		if (chain < 0 || index < 0)
			throw new DescriptorException(String.format("Invalid derivation %d/%d", chain, index));

		DeterministicKey key;
		try {
			DeterministicKey chainKey = this.chainKeys.computeIfAbsent(chain,
					c -> HDKeyDerivation.deriveChildKey(this.accountKey, new ChildNumber(c, false)));

			key = HDKeyDerivation.deriveChildKey(chainKey, new ChildNumber(index, false));
		} catch (HDDerivationException e) {
			throw new DescriptorException(String.format("Unable to derive key %d/%d", chain, index), e);
		}

		switch (this.descriptor.getScriptKind()) {
			case P2WPKH:
				return SegwitAddress.fromKey(this.params, key).toString();

			case P2PKH:
				return LegacyAddress.fromKey(this.params, key).toString();

			case P2SH_P2WPKH:
				Script redeemScript = ScriptBuilder.createP2WPKHOutputScript(key);
				return LegacyAddress.fromScriptHash(this.params, Utils.sha256hash160(redeemScript.getProgram())).toString();

			default:
				throw new DescriptorException(String.format("Unsupported script kind %s", this.descriptor.getScriptKind()));
		}
	}

	@Override
	public String derivationPath(int chain, int index) {
		return this.descriptor.derivationPath(chain, index);
	}

}
