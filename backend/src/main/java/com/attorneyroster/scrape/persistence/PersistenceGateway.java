package com.attorneyroster.scrape.persistence;

import com.attorneyroster.scrape.model.AttorneyRecord;
import com.attorneyroster.scrape.model.UpsertResult;

import java.util.List;

/**
 * Write side used by the traversal. Implementations throw
 * {@link org.springframework.dao.DataAccessException} on storage failures.
 */
public interface PersistenceGateway {

    /**
     * Inserts or updates the record keyed on (jurisdiction, bar number). A record without a bar
     * number cannot be matched and is always inserted.
     */
    UpsertResult upsert(AttorneyRecord record);

    /**
     * Links practice areas to a stored attorney. The first area in the list is the primary one.
     */
    void attachPracticeAreas(long attorneyId, List<String> practiceAreas);
}
