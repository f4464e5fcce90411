package app.fieldbridge.importer.repository;

import app.fieldbridge.importer.domain.ImportSessionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface ImportSessionRepository extends JpaRepository<ImportSessionEntity, UUID> {
}
