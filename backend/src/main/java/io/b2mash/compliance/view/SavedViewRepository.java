package io.b2mash.compliance.view;

import io.b2mash.compliance.view.property.ViewEntityType;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SavedViewRepository extends JpaRepository<SavedView, UUID> {

  @Query("SELECT v FROM SavedView v WHERE v.id = :id AND v.organizationId = :organizationId")
  Optional<SavedView> findByIdAndOrganizationId(
      @Param("id") UUID id, @Param("organizationId") String organizationId);

  /**
   * Returns the member's own views plus every shared view of the entity type, pinned first, then
   * by display order and name. Team and everyone scopes are narrowed by the caller.
   */
  @Query(
      "SELECT v FROM SavedView v WHERE v.organizationId = :organizationId"
          + " AND v.entityType = :entityType AND (v.createdBy = :memberId OR v.isShared = true)"
          + " ORDER BY v.isPinned DESC, v.displayOrder, v.name")
  List<SavedView> findAccessible(
      @Param("organizationId") String organizationId,
      @Param("entityType") ViewEntityType entityType,
      @Param("memberId") UUID memberId);

  @Query(
      "SELECT v FROM SavedView v WHERE v.organizationId = :organizationId"
          + " AND v.entityType = :entityType AND v.createdBy = :memberId AND v.isDefault = true")
  Optional<SavedView> findDefault(
      @Param("organizationId") String organizationId,
      @Param("entityType") ViewEntityType entityType,
      @Param("memberId") UUID memberId);

  @Query(
      "SELECT v FROM SavedView v WHERE v.organizationId = :organizationId"
          + " AND v.createdBy = :memberId AND v.id IN :ids")
  List<SavedView> findOwnedByIds(
      @Param("organizationId") String organizationId,
      @Param("memberId") UUID memberId,
      @Param("ids") Collection<UUID> ids);

  @Query(
      "SELECT COUNT(v) > 0 FROM SavedView v WHERE v.organizationId = :organizationId"
          + " AND v.createdBy = :memberId AND v.entityType = :entityType AND v.name = :name")
  boolean existsOwnedByName(
      @Param("organizationId") String organizationId,
      @Param("memberId") UUID memberId,
      @Param("entityType") ViewEntityType entityType,
      @Param("name") String name);

  @Query(
      "SELECT COUNT(v) > 0 FROM SavedView v WHERE v.organizationId = :organizationId"
          + " AND v.createdBy = :memberId AND v.entityType = :entityType AND v.name = :name"
          + " AND v.id <> :excludedId")
  boolean existsOwnedByNameExcluding(
      @Param("organizationId") String organizationId,
      @Param("memberId") UUID memberId,
      @Param("entityType") ViewEntityType entityType,
      @Param("name") String name,
      @Param("excludedId") UUID excludedId);

  @Query(
      "SELECT COALESCE(MAX(v.displayOrder), -1) + 1 FROM SavedView v"
          + " WHERE v.organizationId = :organizationId AND v.createdBy = :memberId"
          + " AND v.entityType = :entityType")
  int nextDisplayOrder(
      @Param("organizationId") String organizationId,
      @Param("memberId") UUID memberId,
      @Param("entityType") ViewEntityType entityType);

  /** Clears the member's current default for the entity type. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "UPDATE SavedView v SET v.isDefault = false WHERE v.organizationId = :organizationId"
          + " AND v.entityType = :entityType AND v.createdBy = :memberId AND v.isDefault = true")
  int clearDefaults(
      @Param("organizationId") String organizationId,
      @Param("entityType") ViewEntityType entityType,
      @Param("memberId") UUID memberId);

  /** Clears the member's current default for the entity type unless it is {@code keptId}. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "UPDATE SavedView v SET v.isDefault = false WHERE v.organizationId = :organizationId"
          + " AND v.entityType = :entityType AND v.createdBy = :memberId AND v.isDefault = true"
          + " AND v.id <> :keptId")
  int clearDefaultsExcept(
      @Param("organizationId") String organizationId,
      @Param("entityType") ViewEntityType entityType,
      @Param("memberId") UUID memberId,
      @Param("keptId") UUID keptId);

  /** Atomic usage bookkeeping; concurrent applies never lose an increment. */
  @Modifying
  @Query(
      "UPDATE SavedView v SET v.useCount = v.useCount + 1, v.lastUsedAt = :usedAt"
          + " WHERE v.id = :id")
  int recordUse(@Param("id") UUID id, @Param("usedAt") Instant usedAt);
}
