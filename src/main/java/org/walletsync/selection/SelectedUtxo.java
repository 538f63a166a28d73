package org.walletsync.selection;

import org.walletsync.data.wallet.UtxoData;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

@XmlAccessorType(XmlAccessType.FIELD)
public class SelectedUtxo {

    private String txid;
    private int vout;
    private String address;
    private long amount;
    private int confirmations;

    protected SelectedUtxo() {
    }

    public SelectedUtxo(String txid, int vout, String address, long amount, int confirmations) {
        this.txid = txid;
        this.vout = vout;
        this.address = address;
        this.amount = amount;
        this.confirmations = confirmations;
    }

    public static SelectedUtxo fromUtxo(UtxoData utxo) {
        return new SelectedUtxo(utxo.getTxid(), utxo.getVout(), utxo.getAddress(), utxo.getAmount(), utxo.getConfirmations());
    }

    public String getTxid() {
        return this.txid;
    }

    public int getVout() {
        return this.vout;
    }

    public String getKey() {
        return UtxoData.buildKey(this.txid, this.vout);
    }

    public String getAddress() {
        return this.address;
    }

    public long getAmount() {
        return this.amount;
    }

    public int getConfirmations() {
        return this.confirmations;
    }
}
