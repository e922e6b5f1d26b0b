package com.mikov.bulkcsvvalidator.model;

/**
 * Credits held for a job between authorization and settlement.
 *
 * @param userId owner of the credits
 * @param credits number of credits held
 * @param availableBefore credits that were available when the hold was placed
 */
public record CreditReservation(String userId, long credits, long availableBefore) {
}
