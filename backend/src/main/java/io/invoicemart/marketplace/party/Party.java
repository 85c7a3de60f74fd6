package io.invoicemart.marketplace.party;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** A marketplace participant known to the directory, used for anchor lookup and email contacts. */
@Entity
@Table(name = "parties")
public class Party {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", nullable = false, length = 20)
  private PartyRole role;

  @Column(name = "display_name", nullable = false, length = 255)
  private String displayName;

  @Column(name = "email", nullable = false, length = 255)
  private String email;

  @Column(name = "company_name", length = 255)
  private String companyName;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Party() {}

  public Party(PartyRole role, String displayName, String email, String companyName) {
    this.role = role;
    this.displayName = displayName;
    this.email = email;
    this.companyName = companyName;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public PartyRole getRole() {
    return role;
  }

  public String getDisplayName() {
    return displayName;
  }

  public String getEmail() {
    return email;
  }

  public String getCompanyName() {
    return companyName;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
