package com.ewale.ewale.service.ussd.handler;

import com.ewale.ewale.dto.ServiceQueryItem;
import com.ewale.ewale.dto.ServiceQueryResponse;
import com.ewale.ewale.dto.UssdRequest;
import com.ewale.ewale.dto.UssdResponse;
import com.ewale.ewale.entity.BuyerFlow;
import com.ewale.ewale.entity.NetworkProvider;
import com.ewale.ewale.service.HubtelCatalogService;
import com.ewale.ewale.service.PaymentRequestService;
import com.ewale.ewale.service.ussd.BundleGroup;
import com.ewale.ewale.service.ussd.SessionState;
import com.ewale.ewale.service.ussd.UssdResponseBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Data bundle purchase: network, buyer, bundle package, then a paged bundle list.
 */
@Component
public class BundleHandler extends ProductHandlerSupport {

    private static final Logger logger = LoggerFactory.getLogger(BundleHandler.class);

    static final int BUNDLES_PER_PAGE = 4;
    static final int BUNDLES_PER_GROUP = 8;

    static final String NEXT_PAGE = "0";
    static final String PREVIOUS_PAGE = "00";
    static final String BACK_TO_PACKAGES = "99";

    private final HubtelCatalogService catalogService;

    public BundleHandler(UssdResponseBuilder responses, PaymentRequestService paymentRequestService,
                         HubtelCatalogService catalogService) {
        super(responses, paymentRequestService);
        this.catalogService = catalogService;
    }

    public UssdResponse selectNetwork(UssdRequest request, SessionState state) {
        NetworkProvider network = AirtimeHandler.network(request.getMessageOrEmpty());
        if (network == null) {
            return responses.error(request.getSessionId(), "Please select 1, 2, or 3");
        }
        state.setNetwork(network);
        state.setMobile(request.getMobile());
        return responses.numberInput(request.getSessionId(), "Buy For",
                "Buy for:\n\n1. My Number\n2. Other Number\n\nSelect option:");
    }

    public UssdResponse selectBuyerFlow(UssdRequest request, SessionState state) {
        switch (request.getMessageOrEmpty()) {
            case "1":
                state.setFlow(BuyerFlow.SELF);
                state.setMobile(request.getMobile());
                return showCategories(request.getSessionId(), state);
            case "2":
                state.setFlow(BuyerFlow.OTHER);
                return responses.phoneInput(request.getSessionId(), "Enter Mobile Number",
                        "Enter recipient's mobile number:");
            default:
                return responses.error(request.getSessionId(), "Please select 1 or 2");
        }
    }

    public UssdResponse enterRecipientMobile(UssdRequest request, SessionState state) {
        String mobile = parseMobile(request.getMessageOrEmpty());
        if (mobile == null) {
            return responses.error(request.getSessionId(), INVALID_MOBILE);
        }
        state.setMobile(mobile);
        return showCategories(request.getSessionId(), state);
    }

    public UssdResponse selectCategory(UssdRequest request, SessionState state) {
        List<BundleGroup> groups = state.getBundleGroups();
        Integer choice = parseChoice(request.getMessageOrEmpty());
        if (choice == null || choice < 1 || choice > groups.size()) {
            return responses.error(request.getSessionId(), "Please select a valid category");
        }
        state.setCategorySelectionMode(false);
        state.setCurrentGroupIndex(choice - 1);
        state.setCurrentBundlePage(0);
        return showBundlePage(request.getSessionId(), state);
    }

    /**
     * Handles a bundle pick or one of the paging commands on the current page.
     */
    public UssdResponse selectBundle(UssdRequest request, SessionState state) {
        String sessionId = request.getSessionId();
        String input = request.getMessageOrEmpty();
        List<ServiceQueryItem> bundles = currentGroup(state).getBundles();
        int start = state.getCurrentBundlePage() * BUNDLES_PER_PAGE;
        int end = Math.min(start + BUNDLES_PER_PAGE, bundles.size());

        if (NEXT_PAGE.equals(input)) {
            if (end >= bundles.size()) {
                return responses.error(sessionId, "No more bundles to show");
            }
            state.setCurrentBundlePage(state.getCurrentBundlePage() + 1);
            return showBundlePage(sessionId, state);
        }
        if (PREVIOUS_PAGE.equals(input)) {
            if (state.getCurrentBundlePage() == 0) {
                return responses.error(sessionId, "Already on first page");
            }
            state.setCurrentBundlePage(state.getCurrentBundlePage() - 1);
            return showBundlePage(sessionId, state);
        }
        if (BACK_TO_PACKAGES.equals(input)) {
            state.setCurrentGroupIndex(0);
            state.setCurrentBundlePage(0);
            state.setCategorySelectionMode(true);
            return categoriesMenu(sessionId, state);
        }

        Integer choice = parseChoice(input);
        if (choice == null || choice < 1 || start + choice > end) {
            return responses.error(sessionId, "Please select a valid bundle option");
        }
        ServiceQueryItem bundle = bundles.get(start + choice - 1);
        state.setSelectedBundle(bundle);
        state.setBundleValue(bundle.getValue());
        state.setAmount(bundle.getAmount());
        state.setTotalAmount(bundle.getAmount());
        logger.info("Session {} selected bundle {} ({})", sessionId, bundle.getValue(), bundle.getAmount());
        return responses.display(sessionId, "Order Summary", summary(state));
    }

    private UssdResponse showCategories(String sessionId, SessionState state) {
        ServiceQueryResponse catalog;
        try {
            catalog = catalogService.queryBundles(state.getNetwork(), state.getMobile());
        } catch (RuntimeException e) {
            logger.error("Error fetching bundles for session {}: {}", sessionId, e.getMessage());
            return responses.error(sessionId, "Unable to fetch bundles. Please try again.");
        }
        if (catalog.getData() == null || catalog.getData().isEmpty()) {
            logger.info("No bundles available for network {}", state.getNetwork());
            return responses.error(sessionId, "No bundles available for this network. Please try another network.");
        }
        state.setBundleGroups(groupByCategory(catalog.getData()));
        state.setCurrentGroupIndex(0);
        state.setCurrentBundlePage(0);
        state.setCategorySelectionMode(true);
        return categoriesMenu(sessionId, state);
    }

    private UssdResponse categoriesMenu(String sessionId, SessionState state) {
        StringBuilder menu = new StringBuilder("Select Bundle Package:\n\n");
        List<BundleGroup> groups = state.getBundleGroups();
        for (int i = 0; i < groups.size(); i++) {
            menu.append(i + 1).append(". ").append(groups.get(i).getName()).append("\n");
        }
        return responses.numberInput(sessionId, "Bundle Packages", menu.toString());
    }

    UssdResponse showBundlePage(String sessionId, SessionState state) {
        BundleGroup group = currentGroup(state);
        List<ServiceQueryItem> bundles = group.getBundles();
        int page = state.getCurrentBundlePage();
        int start = page * BUNDLES_PER_PAGE;
        int end = Math.min(start + BUNDLES_PER_PAGE, bundles.size());
        int totalPages = (bundles.size() + BUNDLES_PER_PAGE - 1) / BUNDLES_PER_PAGE;

        StringBuilder menu = new StringBuilder(group.getName()).append(":\n\n");
        for (int i = start; i < end; i++) {
            ServiceQueryItem bundle = bundles.get(i);
            menu.append(i - start + 1).append(". ").append(bundle.getDisplay())
                    .append(" - GH").append(bundle.getAmount()).append("\n");
        }
        menu.append("\n");
        if (page > 0) {
            menu.append(PREVIOUS_PAGE).append(". Back\n");
        }
        if (end < bundles.size()) {
            menu.append(NEXT_PAGE).append(". Next\n");
        }
        menu.append(BACK_TO_PACKAGES).append(". Back to Packages\n");

        return responses.numberInput(sessionId, "Page " + (page + 1) + " of " + totalPages, menu.toString());
    }

    private static BundleGroup currentGroup(SessionState state) {
        return state.getBundleGroups().get(state.getCurrentGroupIndex());
    }

    /**
     * Groups in first-seen order, each capped at {@link #BUNDLES_PER_GROUP} bundles.
     */
    static List<BundleGroup> groupByCategory(List<ServiceQueryItem> bundles) {
        Map<String, List<ServiceQueryItem>> grouped = new LinkedHashMap<>();
        for (ServiceQueryItem bundle : bundles) {
            grouped.computeIfAbsent(category(bundle), key -> new ArrayList<>()).add(bundle);
        }
        List<BundleGroup> groups = new ArrayList<>();
        for (Map.Entry<String, List<ServiceQueryItem>> entry : grouped.entrySet()) {
            List<ServiceQueryItem> items = entry.getValue();
            groups.add(new BundleGroup(entry.getKey(),
                    new ArrayList<>(items.subList(0, Math.min(BUNDLES_PER_GROUP, items.size())))));
        }
        return groups;
    }

    static String category(ServiceQueryItem bundle) {
        String display = lower(bundle.getDisplay());
        String value = lower(bundle.getValue());

        // AT
        if (value.contains("bigtime") || display.contains("bigtime")) {
            return "BigTime Data";
        }
        if (value.contains("fuse") || display.contains("fuse")) {
            return "Fuse Bundles";
        }
        if (value.contains("kokoo") || display.contains("kokoo")) {
            return "Kokoo Bundles";
        }
        if (value.contains("xxl") || display.contains("xxl")) {
            return "XXL Family Bundles";
        }
        // Telecel
        if (value.contains("bnight") || display.contains("12am") || display.contains("5am")) {
            return "Night Bundles";
        }
        if (value.contains("hrboost") || display.contains("1 hour")) {
            return "Hour Boost";
        }
        if (display.contains("no expiry")) {
            return "No Expiry Bundles";
        }
        if (display.contains("1 day") || display.contains("3 days") || display.contains("5 days")
                || display.contains("15 days") || display.contains("30 days")) {
            return "Time-Based Bundles";
        }
        // MTN
        if (display.contains("kokrokoo") || value.contains("kokrokoo")) {
            return "Kokrokoo Bundles";
        }
        if (display.contains("video") || value.contains("video")) {
            return "Video Bundles";
        }
        if (display.contains("social") || value.contains("social")) {
            return "Social Media Bundles";
        }
        return "Data Bundles";
    }

    static String summary(SessionState state) {
        return "Bundle Package:\n\n"
                + "Network: " + state.getNetwork().getDisplayName() + "\n"
                + "Bundle: " + state.getSelectedBundle().getDisplay() + "\n"
                + "Mobile: " + state.getMobile() + " (" + (state.getFlow() == BuyerFlow.OTHER ? "Other" : "Self") + ")\n"
                + amountLine(state.getTotalAmount()) + "\n\n"
                + CONFIRM_OPTIONS;
    }

    private static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }
}
