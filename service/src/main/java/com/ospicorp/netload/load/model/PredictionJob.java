package com.ospicorp.netload.load.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "predictions")
public class PredictionJob {

  @Id
  private Long id;
  private String name;

  @Column(name = "resolution_minutes")
  private Integer resolutionMinutes;   // forecast resolution, defaults the API's bucket width

  private boolean active;

  public PredictionJob() {
    // JPA default constructor
  }

  public PredictionJob(Long id, String name, Integer resolutionMinutes, boolean active) {
    this.id = id;
    this.name = name;
    this.resolutionMinutes = resolutionMinutes;
    this.active = active;
  }

  public Long getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public Integer getResolutionMinutes() {
    return resolutionMinutes;
  }

  public boolean isActive() {
    return active;
  }
}
