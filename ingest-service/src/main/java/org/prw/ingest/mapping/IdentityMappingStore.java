package org.prw.ingest.mapping;

import org.prw.data.identity.IdentityMapping;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Persistent source id to pseudonymous id mapping. Both directions of the mapping are
 * unique, and rows are only ever added.
 */
public interface IdentityMappingStore {

    /**
     * @return the current mapping, source id to pseudonymous id
     * @throws IOException if the store cannot be read or violates uniqueness
     */
    Map<String, String> load() throws IOException;

    /**
     * Persists new rows. Either every row is stored or none is.
     */
    void append(List<IdentityMapping> rows) throws IOException;
}
