package com.baufi.portfolio;

import com.baufi.common.Result;

import java.util.List;

/**
 * Storage of portfolio mortgages. Implementations return domain objects re-validated through their factories.
 */
public interface MortgageRepository {

    /** Inserts or replaces; assigns an id when the mortgage has none. */
    Result<Mortgage, RepositoryError> save(Mortgage mortgage);

    Result<Mortgage, RepositoryError> findById(String id);

    Result<List<Mortgage>, RepositoryError> findAll();

    Result<Void, RepositoryError> delete(String id);
}
