package com.hiddenmarkov.config;

import java.util.List;

public class ModelCatalog {
    public List<ModelDefinition> models;
}
