package com.mikov.bulkcsvvalidator.services;

import com.mikov.bulkcsvvalidator.exception.InsufficientCreditsException;
import com.mikov.bulkcsvvalidator.exception.InvalidJobRequestException;
import com.mikov.bulkcsvvalidator.exception.StorageException;
import com.mikov.bulkcsvvalidator.exception.UserNotFoundException;
import com.mikov.bulkcsvvalidator.model.CreditReservation;
import com.mikov.bulkcsvvalidator.model.JobStats;
import com.mikov.bulkcsvvalidator.model.UserAccount;
import com.mikov.bulkcsvvalidator.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Gates jobs on the user's credit balance and debits it when a job completes.
 * Authorization places a hold on the credits, settlement turns the hold into a debit in the
 * same transaction that marks the job completed, and a failed run only releases the hold.
 *
 * @author zahari.mikov
 */
@Slf4j
@Service
public class CreditLedger {

    private final UserRepository userRepository;
    private final JobStatusRecorder jobStatusRecorder;
    private final TransactionTemplate transactionTemplate;

    public CreditLedger(final UserRepository userRepository,
                        final JobStatusRecorder jobStatusRecorder,
                        final PlatformTransactionManager transactionManager) {
        this.userRepository = userRepository;
        this.jobStatusRecorder = jobStatusRecorder;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public UserAccount findUser(final String userEmail) {
        try {
            return userRepository.findByEmail(userEmail).orElseThrow(() -> new UserNotFoundException(userEmail));
        } catch (final DataAccessException e) {
            throw new StorageException("Failed to read user " + userEmail + ": " + e.getMessage(), e);
        }
    }

    /**
     * Holds {@code requiredCredits} for a job. Must succeed before any verification work starts.
     *
     * @throws UserNotFoundException when no account exists for the email
     * @throws InsufficientCreditsException when the unheld balance is below the requirement
     */
    public CreditReservation authorize(final String userEmail, final long requiredCredits) {
        if (requiredCredits < 0) {
            throw new InvalidJobRequestException("Required credits cannot be negative: " + requiredCredits);
        }
        final var user = findUser(userEmail);
        if (user.availableCredits() < requiredCredits) {
            throw new InsufficientCreditsException(requiredCredits, user.availableCredits());
        }
        try {
            if (!userRepository.reserveCredits(user.getUserId(), requiredCredits)) {
                final var current = findUser(userEmail);
                throw new InsufficientCreditsException(requiredCredits, current.availableCredits());
            }
        } catch (final DataAccessException e) {
            throw new StorageException("Failed to reserve credits for " + userEmail + ": " + e.getMessage(), e);
        }
        log.info("Reserved {} credits for user {} ({} were available)", requiredCredits, user.getUserId(),
            user.availableCredits());
        return new CreditReservation(user.getUserId(), requiredCredits, user.availableCredits());
    }

    /**
     * Debits the held credits and marks the job COMPLETED atomically. Either both happen or neither.
     */
    public void settle(final CreditReservation reservation, final String fileId, final JobStats stats) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                if (!userRepository.debitReserved(reservation.userId(), reservation.credits())) {
                    throw new StorageException("No hold of " + reservation.credits() + " credits found for user "
                        + reservation.userId());
                }
                jobStatusRecorder.recordSuccess(fileId, stats, reservation.credits());
            });
        } catch (final DataAccessException e) {
            throw new StorageException("Failed to settle credits for job " + fileId + ": " + e.getMessage(), e);
        }
        log.info("Settled {} credits for user {} on job {}", reservation.credits(), reservation.userId(), fileId);
    }

    /**
     * Drops the hold of a run that did not complete. Best effort: a failure is logged so the
     * run's own error is the one reported.
     */
    public void release(final CreditReservation reservation) {
        try {
            if (!userRepository.releaseReservation(reservation.userId(), reservation.credits())) {
                log.warn("No hold of {} credits found for user {}", reservation.credits(), reservation.userId());
                return;
            }
            log.info("Released {} held credits for user {}", reservation.credits(), reservation.userId());
        } catch (final DataAccessException e) {
            log.error("Could not release {} credits for user {}: {}", reservation.credits(), reservation.userId(),
                e.getMessage());
        }
    }
}
