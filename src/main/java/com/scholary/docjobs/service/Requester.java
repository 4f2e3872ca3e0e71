package com.scholary.docjobs.service;

import java.util.UUID;

/** The authenticated caller, as established by the fronting auth layer. */
public record Requester(UUID userId, boolean admin) {

  public Requester {
    if (userId == null) {
      throw new IllegalArgumentException("userId must be set");
    }
  }

  /** Admins may read any job; everyone else only their own. */
  public boolean canRead(UUID ownerId) {
    return admin || userId.equals(ownerId);
  }
}
