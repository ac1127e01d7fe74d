package com.architecture.inventory.service.graph;

import com.architecture.inventory.dto.MapView;
import com.architecture.inventory.model.Asset;
import com.architecture.inventory.model.AssetTypeRegistry;
import com.architecture.inventory.model.LabelField;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Plans the standard set of views over an annotated asset list:
 * <ul>
 *   <li>{@code index}: every asset</li>
 *   <li>{@code _unapplied}: assets not leading to an application, dependency-closed</li>
 *   <li>{@code _<type>}: per registered type, the assets leading to that type</li>
 *   <li>{@code _<id>}: per application asset, everything it depends on</li>
 * </ul>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ViewPlanner {

    static final String APPLICATION_PREFIX = "application/";

    private final SubgraphSelector selector;
    private final AssetTypeRegistry registry;

    public List<MapView> plan(List<Asset> assets) {
        List<MapView> views = new ArrayList<>();
        views.add(view("index", "All assets", assets, ".*", LabelField.TYPE, false));
        views.add(view("_unapplied", "Assets not leading to an asset of type " + APPLICATION_PREFIX + ".*",
                assets, APPLICATION_PREFIX + ".*", LabelField.TYPE, true));
        // type names and ids are exact labels, not patterns
        for (String type : registry.typeNames()) {
            views.add(view("_" + type.replace('/', '_'), type + " assets only",
                    assets, Pattern.quote(type), LabelField.TYPE, false));
        }
        for (Asset asset : assets) {
            if (asset.getType() != null && asset.getType().startsWith(APPLICATION_PREFIX)) {
                views.add(view("_" + asset.getId(), asset.getId() + " assets only",
                        assets, Pattern.quote(asset.getId()), LabelField.ID, false));
            }
        }
        log.info("Planned {} views over {} assets", views.size(), assets.size());
        return views;
    }

    private MapView view(String name, String description, List<Asset> assets, String labelPattern,
                         LabelField field, boolean negate) {
        List<Asset> selected = selector.select(assets, labelPattern, field, negate);
        log.debug("Showing {} of {} assets for {}", selected.size(), assets.size(), name);
        return MapView.builder()
                .name(name)
                .description(description)
                .labelPattern(labelPattern)
                .field(field)
                .negated(negate)
                .assets(selected)
                .build();
    }
}
