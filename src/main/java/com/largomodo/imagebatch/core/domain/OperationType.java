package com.largomodo.imagebatch.core.domain;

/**
 * Kind of per-image work a batch operation performs.
 * <p>
 * Opaque to the engine beyond executor lookup: each type is mapped to an
 * {@link com.largomodo.imagebatch.core.ImageOperationExecutor} through the
 * {@link com.largomodo.imagebatch.core.ExecutorRegistry}.
 */
public enum OperationType {
    APPLY_TEMPLATE,
    MOUNT_IMAGES,
    UNMOUNT_IMAGES,
    VALIDATE_IMAGES,
    OPTIMIZE_IMAGES,
    EXPORT_IMAGES,
    CONVERT_IMAGES,
    BACKUP_IMAGES,
    DEPLOY_IMAGES,
    DEBLOAT_IMAGES,
    INSTALL_UPDATES,
    ADD_DRIVERS,
    REMOVE_COMPONENTS,
    APPLY_REGISTRY_CHANGES,
    CUSTOM
}
