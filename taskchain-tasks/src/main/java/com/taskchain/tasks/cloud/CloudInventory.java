package com.taskchain.tasks.cloud;

import java.util.List;

/**
 * Read access to a user's cloud backends.
 */
public interface CloudInventory {

    List<Machine> listMachines(String userId, String backendId) throws CloudProviderException;

    List<CatalogEntry> listImages(String userId, String backendId) throws CloudProviderException;

    List<CatalogEntry> listSizes(String userId, String backendId) throws CloudProviderException;

    List<CatalogEntry> listLocations(String userId, String backendId) throws CloudProviderException;
}
