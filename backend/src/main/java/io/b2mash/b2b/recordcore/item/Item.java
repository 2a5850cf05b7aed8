package io.b2mash.b2b.recordcore.item;

import io.b2mash.b2b.recordcore.record.ManagedRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

@Entity
@Table(name = "items")
public class Item extends ManagedRecord {

  @Column(name = "name", length = 255)
  private String name;

  protected Item() {}

  public Item(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }
}
