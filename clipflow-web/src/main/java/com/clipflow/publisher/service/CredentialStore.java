package com.clipflow.publisher.service;

import com.clipflow.publisher.exception.PersistenceException;
import com.clipflow.publisher.model.Platform;
import com.clipflow.publisher.model.PlatformCredential;
import com.clipflow.publisher.repository.PlatformCredentialRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Persistence for platform credentials. Keeps at most one active record per platform: activating
 * a record deactivates the others in the same transaction, and the version column makes a
 * concurrent replacement fail instead of overwriting.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialStore {

    private final PlatformCredentialRepository repository;

    public Optional<PlatformCredential> findActive(Platform platform) {
        return repository.findFirstByPlatformAndActiveTrueOrderByLastRefreshedAtDesc(platform);
    }

    /** Active record, or the most recent inactive one when none is active. */
    public Optional<PlatformCredential> findCurrent(Platform platform) {
        Optional<PlatformCredential> active = findActive(platform);
        return active.isPresent() ? active : repository.findFirstByPlatformOrderByLastRefreshedAtDesc(platform);
    }

    public void deactivate(PlatformCredential credential) {
        try {
            credential.setActive(false);
            repository.save(credential);
            log.info("Deactivated {} credential {}", credential.getPlatform(), credential.getId());
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to deactivate " + credential.getPlatform() + " credential", e);
        }
    }

    /**
     * Swaps {@code previous} for {@code replacement}. Fails with {@link PersistenceException} when
     * {@code previous} changed since it was read, for example by a concurrent refresh.
     */
    @Transactional
    public PlatformCredential replace(PlatformCredential previous, PlatformCredential replacement) {
        try {
            previous.setActive(false);
            repository.saveAndFlush(previous);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new PersistenceException(previous.getPlatform() + " credential was modified concurrently", e);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to replace " + previous.getPlatform() + " credential", e);
        }
        return activate(replacement);
    }

    @Transactional
    public PlatformCredential activate(PlatformCredential credential) {
        try {
            for (PlatformCredential existing : repository.findByPlatformAndActiveTrue(credential.getPlatform())) {
                existing.setActive(false);
                repository.saveAndFlush(existing);
            }
            credential.setActive(true);
            return repository.save(credential);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new PersistenceException(credential.getPlatform() + " credential was modified concurrently", e);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to store " + credential.getPlatform() + " credential", e);
        }
    }
}
