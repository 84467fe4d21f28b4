package com.arkive.spi;

import com.arkive.spi.models.Actor;
import com.arkive.spi.models.AuditChainStatus;
import com.arkive.spi.models.AuditEntry;
import com.arkive.spi.models.AuditFilter;
import com.arkive.spi.models.AuditResource;
import com.arkive.spi.models.enums.AuditAction;

import java.util.List;
import java.util.Map;

/**
 * Append-only, hash-chained record of security relevant actions.
 * <p>
 * Offers no way to update or delete an entry. Implementations also reject such changes at the storage level,
 * so code bypassing this interface cannot rewrite history either.
 */
public interface AuditTrail {

    /**
     * Records one action. Reading the previous hash and inserting the new entry happen atomically, so concurrent
     * appends never share a previous hash.
     *
     * @return the committed entry, sequence id and hashes filled in
     * @throws com.arkive.spi.exceptions.AuditWriteException if the entry could not be committed. Nothing was recorded.
     */
    AuditEntry append(Actor actor, AuditAction action, AuditResource resource, Map<String, Object> metadata, boolean success);

    /**
     * Re-verifies every entry in ascending sequence order and stops at the first violation.
     */
    AuditChainStatus verifyChain();

    List<AuditEntry> query(AuditFilter filter);

    /**
     * Counts the entries matching {@code filter}, ignoring its limit and offset.
     */
    long count(AuditFilter filter);
}
