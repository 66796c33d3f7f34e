package dev.vidcrawl.store;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.Objects;

/** Lookup entity keyed by hashtag name, stored as received. */
@Entity
@Table(name = "hashtag")
public class Hashtag {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false, unique = true)
  private String name;

  protected Hashtag() {
    // JPA requires no-arg constructor
  }

  public Hashtag(String name) {
    this.name = name;
  }

  public Long getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Hashtag other && Objects.equals(name, other.name));
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name);
  }

  @Override
  public String toString() {
    return "Hashtag{id=" + id + ", name='" + name + "'}";
  }
}
