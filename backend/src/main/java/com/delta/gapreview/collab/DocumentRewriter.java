package com.delta.gapreview.collab;

import java.util.List;

public interface DocumentRewriter {

    DocumentEditResult applyEdits(String documentRef, List<String> insertions);
}
