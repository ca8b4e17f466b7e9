package com.civicdesk.query.repository;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

/**
 * Reactive persistence gateway for query rows. Spring Data generates the
 * implementation at runtime; field-level merges go through {@link R2dbcQueryStore}.
 */
@Repository
public interface QueryEntityRepository extends ReactiveCrudRepository<QueryEntity, String> {

}
