package com.example.craftscore.repository;

import com.example.craftscore.model.CraftUser;
import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Users and their scoring sub-document (collection users).
 */
public interface CraftUserRepository extends MongoRepository<CraftUser, String> {
}
