package com.zatca.fatoora.chain;

import com.zatca.fatoora.crypto.InvoiceHashService;
import com.zatca.fatoora.exception.ChainIntegrityException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Checks that a set of entries forms one linear chain: consecutive ICVs,
 * each PIH equal to the previous invoice's hash, each hash matching its XML.
 * A chain starting at ICV 1 must start from the initial hash.
 */
public final class ChainVerifier {

    private ChainVerifier() {
    }

    public static ChainVerificationResult verify(List<ChainEntry> entries) {
        List<ChainEntry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparingLong(ChainEntry::getIcv));

        List<String> problems = new ArrayList<>();
        ChainEntry previous = null;
        for (ChainEntry entry : sorted) {
            if (!InvoiceHashService.hash(entry.getXml()).equals(entry.getInvoiceHash())) {
                problems.add("ICV " + entry.getIcv() + ": hash does not match XML");
            }

            if (previous == null) {
                if (entry.getIcv() == 1 && !InvoiceHashService.INITIAL_HASH.equals(entry.getPreviousHash())) {
                    problems.add("ICV 1: previous hash is not the initial hash");
                }
            } else if (entry.getIcv() == previous.getIcv()) {
                problems.add("ICV " + entry.getIcv() + ": duplicate");
            } else {
                if (entry.getIcv() != previous.getIcv() + 1) {
                    problems.add("ICV " + entry.getIcv() + ": gap after ICV " + previous.getIcv());
                }
                if (!previous.getInvoiceHash().equals(entry.getPreviousHash())) {
                    problems.add("ICV " + entry.getIcv() + ": previous hash does not match ICV " + previous.getIcv());
                }
            }
            previous = entry;
        }
        return new ChainVerificationResult(problems);
    }

    /**
     * @throws ChainIntegrityException listing the first problem if the chain is broken
     */
    public static void verifyOrThrow(String organizationId, List<ChainEntry> entries) {
        ChainVerificationResult result = verify(entries);
        if (!result.isValid()) {
            throw new ChainIntegrityException(
                "Broken chain for organization " + organizationId + ": " + result.getProblems(),
                ChainIntegrityException.BROKEN_CHAIN,
                organizationId
            );
        }
    }
}
