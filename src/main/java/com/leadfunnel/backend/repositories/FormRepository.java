package com.leadfunnel.backend.repositories;

import com.leadfunnel.backend.models.Form;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FormRepository extends JpaRepository<Form, Long> {

    List<Form> findAllByOrderByCreatedAtDesc();

    long countByActiveTrue();
}
