package dev.vidcrawl.store;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.Objects;

/** Lookup entity keyed by the API's effect id string. */
@Entity
@Table(name = "effect")
public class Effect {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "effect_id", nullable = false, unique = true)
  private String effectId;

  protected Effect() {
    // JPA requires no-arg constructor
  }

  public Effect(String effectId) {
    this.effectId = effectId;
  }

  public Long getId() {
    return id;
  }

  public String getEffectId() {
    return effectId;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Effect other && Objects.equals(effectId, other.effectId));
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(effectId);
  }

  @Override
  public String toString() {
    return "Effect{id=" + id + ", effectId='" + effectId + "'}";
  }
}
