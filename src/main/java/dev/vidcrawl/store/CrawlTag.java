package dev.vidcrawl.store;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.Objects;

/** Caller-supplied label attached to a crawl and to every video it discovers. */
@Entity
@Table(name = "crawl_tag")
public class CrawlTag {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false, unique = true)
  private String name;

  protected CrawlTag() {
    // JPA requires no-arg constructor
  }

  public CrawlTag(String name) {
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
    return this == o || (o instanceof CrawlTag other && Objects.equals(name, other.name));
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name);
  }

  @Override
  public String toString() {
    return "CrawlTag{id=" + id + ", name='" + name + "'}";
  }
}
