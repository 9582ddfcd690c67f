package com.apfconfig.ensurer;

import java.util.List;

public interface Remover {

    void removeAutoUpdateEnabledObjects(List<String> names);
}
