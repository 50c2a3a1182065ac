package com.hargapangan.market;

import java.util.Collection;

/**
 * Storage of evidence images attached to market reports. Upload itself happens outside this service;
 * reports only hold references.
 */
public interface EvidenceFileStore {

    /** Best-effort removal; missing files are ignored. */
    void deleteAll(Collection<String> references);
}
