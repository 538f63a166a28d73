package org.walletsync.node;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;
import java.util.List;
import java.util.stream.Collectors;

@XmlAccessorType(XmlAccessType.FIELD)
public class NodeTransaction {

	private String txid;
	/** Block height, or null if unconfirmed */
	private Integer blockHeight;
	/** Block timestamp, seconds since epoch, or null if unconfirmed */
	private Long blockTime;

	@XmlAccessorType(XmlAccessType.FIELD)
	public static class Input {
		private String prevTxid;
		private int prevVout;
		/** Address of spent output, if the node supplied prevout details */
		private String address;
		/** Value of spent output in satoshis, if the node supplied prevout details */
		private Long value;
		private int sequence;

		protected Input() {
		}

		public Input(String prevTxid, int prevVout, String address, Long value, int sequence) {
			this.prevTxid = prevTxid;
			this.prevVout = prevVout;
			this.address = address;
			this.value = value;
			this.sequence = sequence;
		}

		public String getPrevTxid() {
			return this.prevTxid;
		}

		public int getPrevVout() {
			return this.prevVout;
		}

		public String getAddress() {
			return this.address;
		}

		public Long getValue() {
			return this.value;
		}

		public int getSequence() {
			return this.sequence;
		}

		/** Coinbase inputs spend nothing. */
		public boolean isCoinbase() {
			return this.prevTxid == null;
		}

		public String toString() {
			return String.format("{prevout %s:%d, sequence %d}", this.prevTxid, this.prevVout, this.sequence);
		}
	}
	private List<Input> inputs;

	@XmlAccessorType(XmlAccessType.FIELD)
	public static class Output {
		private int index;
		/** Value in satoshis */
		private long value;
		/** Hex-encoded output script */
		private String scriptPubKey;
		/** Null for outputs without a standard address, e.g. OP_RETURN */
		private String address;

		protected Output() {
		}

		public Output(int index, long value, String scriptPubKey, String address) {
			this.index = index;
			this.value = value;
			this.scriptPubKey = scriptPubKey;
			this.address = address;
		}

		public int getIndex() {
			return this.index;
		}

		public long getValue() {
			return this.value;
		}

		public String getScriptPubKey() {
			return this.scriptPubKey;
		}

		public String getAddress() {
			return this.address;
		}

		public String toString() {
			return String.format("{output %d: %d sats to %s}", this.index, this.value, this.address);
		}
	}
	private List<Output> outputs;

	protected NodeTransaction() {
	}

	public NodeTransaction(String txid, Integer blockHeight, Long blockTime, List<Input> inputs, List<Output> outputs) {
		this.txid = txid;
		this.blockHeight = blockHeight;
		this.blockTime = blockTime;
		this.inputs = inputs;
		this.outputs = outputs;
	}

	public String getTxid() {
		return this.txid;
	}

	public Integer getBlockHeight() {
		return this.blockHeight;
	}

	public Long getBlockTime() {
		return this.blockTime;
	}

	public List<Input> getInputs() {
		return this.inputs;
	}

	public List<Output> getOutputs() {
		return this.outputs;
	}

	/** Returns output with given index, or null if there is no such output. */
	public Output getOutput(int index) {
		for (Output output : this.outputs)
			if (output.getIndex() == index)
				return output;

		return null;
	}

	public String toString() {
		return String.format("txid %s, height %s, %d inputs, %d outputs: %s => %s",
				this.txid, this.blockHeight, this.inputs.size(), this.outputs.size(),
				this.inputs.stream().map(Input::toString).collect(Collectors.joining(", ")),
				this.outputs.stream().map(Output::toString).collect(Collectors.joining(", ")));
	}

}
