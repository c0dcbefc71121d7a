package com.al.graphsubscriptions.service.graph;

import com.al.graphsubscriptions.service.auth.AccessToken;

import java.util.List;

/**
 * Directory lookups made with the signed-in user's delegated credential.
 */
public interface GraphDirectoryClient {

    GraphUser getMe(AccessToken delegated);

    List<GraphTeam> listJoinedTeams(AccessToken delegated);
}
