package com.di.dataqc.reconcile;

import com.di.dataqc.dataset.Dataset;

/**
 * A dataset with the display name it is reported under.
 */
public record NamedDataset(String name, Dataset dataset) {
}
