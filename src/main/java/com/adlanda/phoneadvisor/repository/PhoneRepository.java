package com.adlanda.phoneadvisor.repository;

import com.adlanda.phoneadvisor.entity.PhoneEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data repository for the {@code phones} table. Catalog order is ascending id,
 * i.e. insertion order.
 */
@Repository
public interface PhoneRepository extends JpaRepository<PhoneEntity, Long> {

    List<PhoneEntity> findAllByOrderByIdAsc();

    @Query("SELECT p.modelName FROM PhoneEntity p ORDER BY p.id")
    List<String> findAllModelNames();

    Optional<PhoneEntity> findFirstByModelNameIgnoreCaseOrderByIdAsc(String modelName);

    Optional<PhoneEntity> findFirstByModelNameContainingIgnoreCaseOrderByIdAsc(String fragment);

    boolean existsByModelNameIgnoreCase(String modelName);
}
