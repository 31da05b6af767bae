package com.example.craftscore.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * User record as far as the scoring engine is concerned.
 * The version field lets concurrent skill updates detect each other.
 */
@Document(collection = "users")
public record CraftUser(
        @Id String id,
        String displayName,
        UserScoring scoring,
        @Version Long version
) {
    public CraftUser {
        if (scoring == null) scoring = UserScoring.initial();
    }

    public CraftUser withScoring(UserScoring newScoring) {
        return new CraftUser(id, displayName, newScoring, version);
    }
}
