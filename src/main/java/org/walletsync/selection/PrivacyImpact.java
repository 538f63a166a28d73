package org.walletsync.selection;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

/**
 * How much a selection links the wallet's addresses together. Score 100 is best.
 */
@XmlAccessorType(XmlAccessType.FIELD)
public class PrivacyImpact {

    private int linkedAddresses;
    private int score;

    protected PrivacyImpact() {
    }

    public PrivacyImpact(int linkedAddresses, int score) {
        this.linkedAddresses = linkedAddresses;
        this.score = score;
    }

    /** Each address beyond the first costs 20 points. */
    public static PrivacyImpact fromLinkedAddresses(int linkedAddresses) {
        int score = 100 - (linkedAddresses - 1) * 20;
        return new PrivacyImpact(linkedAddresses, Math.max(0, Math.min(100, score)));
    }

    public int getLinkedAddresses() {
        return this.linkedAddresses;
    }

    public int getScore() {
        return this.score;
    }
}
